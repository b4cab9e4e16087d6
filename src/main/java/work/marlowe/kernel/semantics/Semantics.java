package work.marlowe.kernel.semantics;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.marlowe.kernel.language.Contract;
import work.marlowe.kernel.language.Input;
import work.marlowe.kernel.language.Observation;
import work.marlowe.kernel.language.Value;
import work.marlowe.kernel.shared.Arithmetic;

/**
 * Public entry point of the interpreter. Instances hold no mutable state and may be shared between threads.
 *
 * <p>{@link #reduceContractUntilQuiescent} and {@link #applyAllInputs} implement the core rules;
 * {@link #computeTransaction} adds the interval checks the ledger performs before running them.
 * Fatal conditions are raised as {@link TransactionException}.
 */
public final class Semantics {
    private static final Logger LOG = LoggerFactory.getLogger(Semantics.class);

    private final long maxSteps;
    private final Reducer reducer;
    private final InputApplier applier;

    private Semantics(long maxSteps, ContinuationHasher hasher) {
        this.maxSteps = maxSteps;
        this.reducer = new Reducer(maxSteps);
        this.applier = new InputApplier(reducer, hasher);
    }

    public static Semantics create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public long maxSteps() {
        return maxSteps;
    }

    public static State emptyState(BigInteger minTime) {
        return State.empty(minTime);
    }

    public BigInteger evalValue(Environment env, State state, Value value) {
        return Evaluator.evalValue(env, state, value);
    }

    public boolean evalObservation(Environment env, State state, Observation observation) {
        return Evaluator.evalObservation(env, state, observation);
    }

    public ReduceStepResult reduceContractStep(Environment env, State state, Contract contract) {
        return reducer.step(env, state, contract);
    }

    public ReduceResult reduceContractUntilQuiescent(Environment env, State state, Contract contract) {
        return reducer.untilQuiescent(env, state, contract);
    }

    public ApplyResult applyInput(Environment env, State state, Contract contract, Input input) {
        return applier.applyInput(env, state, contract, input);
    }

    public ApplyAllResult applyAllInputs(Environment env, State state, Contract contract, List<Input> inputs) {
        return applier.applyAllInputs(env, state, contract, inputs);
    }

    /**
     * Runs a transaction the way the ledger validates it: the interval is checked and trimmed against
     * {@code state.minTime()}, inputs are applied, and a transaction that changes nothing is rejected.
     */
    public TransactionOutput computeTransaction(Transaction transaction, State state, Contract contract) {
        var interval = transaction.interval();
        if (interval.to().compareTo(interval.from()) < 0) {
            throw new TransactionException(
                TransactionError.INVALID_INTERVAL,
                "Invalid interval: " + interval.from() + " > " + interval.to(),
                interval
            );
        }
        if (interval.to().compareTo(state.minTime()) < 0) {
            throw new TransactionException(
                TransactionError.INTERVAL_IN_PAST,
                "Interval ends at " + interval.to() + ", before the contract minimum time " + state.minTime(),
                Map.of("minTime", state.minTime(), "interval", interval)
            );
        }
        var low = Arithmetic.max(interval.from(), state.minTime());
        var env = new Environment(new TimeInterval(low, interval.to()));
        var result = applyAllInputs(env, state.withMinTime(low), contract, transaction.inputs());
        if (!result.contractChanged()
            && (!(contract instanceof Contract.Close) || state.accounts().isEmpty())) {
            throw new TransactionException(TransactionError.USELESS_TRANSACTION, "Transaction does not change the contract");
        }
        LOG.debug(
            "Transaction applied: {} input(s), {} payment(s), {} warning(s)",
            transaction.inputs().size(),
            result.payments().size(),
            result.warnings().size()
        );
        return new TransactionOutput(result.warnings(), result.payments(), result.state(), result.continuation());
    }

    /**
     * Runs {@code transactions} in order from an empty state, accumulating warnings and payments.
     */
    public TransactionOutput playTrace(BigInteger startTime, Contract contract, List<Transaction> transactions) {
        var warnings = new ArrayList<TransactionWarning>();
        var payments = new ArrayList<Payment>();
        var state = emptyState(startTime);
        var current = contract;
        for (Transaction transaction : transactions) {
            var output = computeTransaction(transaction, state, current);
            warnings.addAll(output.warnings());
            payments.addAll(output.payments());
            state = output.state();
            current = output.contract();
        }
        return new TransactionOutput(warnings, payments, state, current);
    }

    public static final class Builder {
        private long maxSteps;
        private ContinuationHasher continuationHasher;

        /**
         * Upper bound on internal steps per reduction; zero or less means unbounded.
         */
        public Builder maxSteps(long maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder continuationHasher(ContinuationHasher continuationHasher) {
            this.continuationHasher = continuationHasher;
            return this;
        }

        public Semantics build() {
            return new Semantics(maxSteps, continuationHasher);
        }
    }
}
