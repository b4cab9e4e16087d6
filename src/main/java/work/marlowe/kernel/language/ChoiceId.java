package work.marlowe.kernel.language;

import java.util.Comparator;
import java.util.Objects;

/**
 * Names a choice and the party entitled to make it.
 */
public record ChoiceId(String choiceName, Party choiceOwner) implements Comparable<ChoiceId> {
    private static final Comparator<ChoiceId> ORDER = Comparator
        .comparing(ChoiceId::choiceName)
        .thenComparing(ChoiceId::choiceOwner);

    public ChoiceId {
        Objects.requireNonNull(choiceName, "choiceName");
        Objects.requireNonNull(choiceOwner, "choiceOwner");
    }

    @Override
    public int compareTo(ChoiceId other) {
        return ORDER.compare(this, other);
    }
}
