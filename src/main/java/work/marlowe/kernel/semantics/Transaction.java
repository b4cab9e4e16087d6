package work.marlowe.kernel.semantics;

import java.util.List;
import java.util.Objects;
import work.marlowe.kernel.language.Input;

/**
 * Inputs submitted together under one validity interval.
 */
public record Transaction(TimeInterval interval, List<Input> inputs) {
    public Transaction {
        Objects.requireNonNull(interval, "interval");
        inputs = List.copyOf(inputs);
    }
}
