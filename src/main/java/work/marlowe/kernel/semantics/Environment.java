package work.marlowe.kernel.semantics;

import java.util.Objects;

/**
 * What the evaluator knows about the outside world: the time interval of the transaction.
 */
public record Environment(TimeInterval timeInterval) {
    public Environment {
        Objects.requireNonNull(timeInterval, "timeInterval");
    }

    public static Environment of(long from, long to) {
        return new Environment(TimeInterval.of(from, to));
    }
}
