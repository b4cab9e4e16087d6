package work.marlowe.kernel.semantics;

import java.util.Objects;
import java.util.Optional;
import work.marlowe.kernel.language.Contract;

/**
 * Outcome of a single internal reduction step.
 */
public sealed interface ReduceStepResult
    permits ReduceStepResult.Reduced, ReduceStepResult.NotReduced, ReduceStepResult.AmbiguousTimeInterval {

    ReduceStepResult NOT_REDUCED = new NotReduced();
    ReduceStepResult AMBIGUOUS_TIME_INTERVAL = new AmbiguousTimeInterval();

    record Reduced(Optional<TransactionWarning> warning, Optional<Payment> payment, State state, Contract continuation)
        implements ReduceStepResult {
        public Reduced {
            Objects.requireNonNull(warning, "warning");
            Objects.requireNonNull(payment, "payment");
            Objects.requireNonNull(state, "state");
            Objects.requireNonNull(continuation, "continuation");
        }
    }

    /** No internal step applies: the contract is closed with empty accounts or waits on a {@code When}. */
    record NotReduced() implements ReduceStepResult {}

    /** The environment straddles the timeout of the current {@code When}. */
    record AmbiguousTimeInterval() implements ReduceStepResult {}
}
