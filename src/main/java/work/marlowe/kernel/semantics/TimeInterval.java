package work.marlowe.kernel.semantics;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Inclusive POSIX-millisecond interval {@code [from, to]}. Ordering of the bounds is checked at the transaction
 * boundary, not here.
 */
public record TimeInterval(BigInteger from, BigInteger to) {
    public TimeInterval {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public static TimeInterval of(long from, long to) {
        return new TimeInterval(BigInteger.valueOf(from), BigInteger.valueOf(to));
    }
}
