package work.marlowe.kernel.language;

import java.util.Objects;

/**
 * Identifier bound by {@code Let} and read back by {@code UseValue}.
 */
public record ValueId(String name) implements Comparable<ValueId> {
    public ValueId {
        Objects.requireNonNull(name, "name");
    }

    public static ValueId of(String name) {
        return new ValueId(name);
    }

    @Override
    public int compareTo(ValueId other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
