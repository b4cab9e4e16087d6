package work.marlowe.kernel.semantics;

import java.util.List;
import java.util.Objects;
import work.marlowe.kernel.language.Contract;

/**
 * Quiescent state reached by {@link Semantics#reduceContractUntilQuiescent}. {@code reduced} tells whether at
 * least one internal step was taken.
 */
public record ReduceResult(
    boolean reduced,
    List<TransactionWarning> warnings,
    List<Payment> payments,
    State state,
    Contract continuation
) {
    public ReduceResult {
        warnings = List.copyOf(warnings);
        payments = List.copyOf(payments);
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(continuation, "continuation");
    }
}
