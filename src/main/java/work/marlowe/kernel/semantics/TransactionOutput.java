package work.marlowe.kernel.semantics;

import java.util.List;
import java.util.Objects;
import work.marlowe.kernel.language.Contract;

public record TransactionOutput(List<TransactionWarning> warnings, List<Payment> payments, State state, Contract contract) {
    public TransactionOutput {
        warnings = List.copyOf(warnings);
        payments = List.copyOf(payments);
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(contract, "contract");
    }
}
