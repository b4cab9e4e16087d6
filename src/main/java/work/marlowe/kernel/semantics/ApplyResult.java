package work.marlowe.kernel.semantics;

import java.util.List;
import java.util.Objects;
import work.marlowe.kernel.language.Contract;

/**
 * Result of applying one input, including the quiescent reduction of the matched continuation.
 */
public record ApplyResult(List<TransactionWarning> warnings, List<Payment> payments, State state, Contract continuation) {
    public ApplyResult {
        warnings = List.copyOf(warnings);
        payments = List.copyOf(payments);
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(continuation, "continuation");
    }
}
