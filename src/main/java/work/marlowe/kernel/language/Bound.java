package work.marlowe.kernel.language;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import work.marlowe.kernel.shared.Arithmetic;

/**
 * Closed interval {@code [from, to]} of numbers a choice may take.
 */
public record Bound(BigInteger from, BigInteger to) {
    public Bound {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public static Bound of(long from, long to) {
        return new Bound(BigInteger.valueOf(from), BigInteger.valueOf(to));
    }

    public boolean contains(BigInteger value) {
        return Arithmetic.between(value, from, to);
    }

    /**
     * True when {@code value} lies in at least one of {@code bounds}.
     */
    public static boolean inBounds(BigInteger value, List<Bound> bounds) {
        for (Bound bound : bounds) {
            if (bound.contains(value)) {
                return true;
            }
        }
        return false;
    }
}
