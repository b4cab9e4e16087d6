package work.marlowe.kernel.advisor;

import java.util.List;
import java.util.Objects;
import work.marlowe.kernel.language.Contract;
import work.marlowe.kernel.language.Input;
import work.marlowe.kernel.semantics.Environment;
import work.marlowe.kernel.semantics.Payment;
import work.marlowe.kernel.semantics.State;
import work.marlowe.kernel.semantics.TransactionWarning;

/**
 * What submitting an applicable action would do: the inputs to send, the environment they were computed for, and
 * the resulting quiescent state and contract. Warnings and payments include those of the initial reduction.
 */
public record AppliedAction(
    List<Input> inputs,
    Environment environment,
    State reducedState,
    Contract reducedContract,
    List<TransactionWarning> warnings,
    List<Payment> payments
) {
    public AppliedAction {
        inputs = List.copyOf(inputs);
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(reducedState, "reducedState");
        Objects.requireNonNull(reducedContract, "reducedContract");
        warnings = List.copyOf(warnings);
        payments = List.copyOf(payments);
    }
}
