package work.marlowe.kernel.semantics;

import java.util.List;
import java.util.Objects;
import work.marlowe.kernel.language.Contract;

/**
 * Result of {@link Semantics#applyAllInputs}. {@code contractChanged} is false only when no input was given and
 * no internal step was possible.
 */
public record ApplyAllResult(
    boolean contractChanged,
    List<TransactionWarning> warnings,
    List<Payment> payments,
    State state,
    Contract continuation
) {
    public ApplyAllResult {
        warnings = List.copyOf(warnings);
        payments = List.copyOf(payments);
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(continuation, "continuation");
    }
}
