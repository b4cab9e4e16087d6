package work.marlowe.kernel.semantics;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.marlowe.kernel.language.Contract;
import work.marlowe.kernel.language.Payee;
import work.marlowe.kernel.shared.Arithmetic;

/**
 * Internal reduction: the steps a contract takes without any external input.
 */
final class Reducer {
    private static final Logger LOG = LoggerFactory.getLogger(Reducer.class);

    private final long maxSteps;

    Reducer(long maxSteps) {
        this.maxSteps = maxSteps;
    }

    ReduceStepResult step(Environment env, State state, Contract contract) {
        if (contract instanceof Contract.Close) {
            return refundOne(state);
        }
        if (contract instanceof Contract.Pay pay) {
            return pay(env, state, pay);
        }
        if (contract instanceof Contract.If branch) {
            var next = Evaluator.evalObservation(env, state, branch.condition()) ? branch.then() : branch.otherwise();
            return reduced(Optional.empty(), Optional.empty(), state, next);
        }
        if (contract instanceof Contract.When when) {
            var interval = env.timeInterval();
            if (interval.to().compareTo(when.timeout()) < 0) {
                return ReduceStepResult.NOT_REDUCED;
            }
            if (when.timeout().compareTo(interval.from()) <= 0) {
                return reduced(Optional.empty(), Optional.empty(), state, when.timeoutContinuation());
            }
            return ReduceStepResult.AMBIGUOUS_TIME_INTERVAL;
        }
        if (contract instanceof Contract.Let let) {
            var evaluated = Evaluator.evalValue(env, state, let.value());
            Optional<TransactionWarning> warning = state.boundValue(let.valueId())
                .filter(previous -> !previous.equals(evaluated))
                .map(previous -> new TransactionWarning.Shadowing(let.valueId(), previous, evaluated));
            return reduced(warning, Optional.empty(), state.withBoundValue(let.valueId(), evaluated), let.then());
        }
        if (contract instanceof Contract.Assert assertion) {
            Optional<TransactionWarning> warning = Evaluator.evalObservation(env, state, assertion.observation())
                ? Optional.empty()
                : Optional.of(TransactionWarning.ASSERTION_FAILED);
            return reduced(warning, Optional.empty(), state, assertion.then());
        }
        throw new IllegalStateException("Unknown contract: " + contract);
    }

    ReduceResult untilQuiescent(Environment env, State initialState, Contract initialContract) {
        var warnings = new ArrayList<TransactionWarning>();
        var payments = new ArrayList<Payment>();
        var state = initialState;
        var contract = initialContract;
        long steps = 0;
        while (true) {
            var result = step(env, state, contract);
            if (result instanceof ReduceStepResult.Reduced reduced) {
                steps++;
                if (maxSteps > 0 && steps > maxSteps) {
                    throw new TransactionException(
                        TransactionError.STEP_LIMIT_EXCEEDED,
                        "Reduction exceeded " + maxSteps + " steps",
                        Map.of("maxSteps", maxSteps)
                    );
                }
                reduced.warning().ifPresent(warnings::add);
                reduced.payment().ifPresent(payments::add);
                state = reduced.state();
                contract = reduced.continuation();
                continue;
            }
            if (result instanceof ReduceStepResult.AmbiguousTimeInterval) {
                throw new TransactionException(
                    TransactionError.AMBIGUOUS_TIME_INTERVAL,
                    "Time interval " + env.timeInterval().from() + ".." + env.timeInterval().to()
                        + " straddles a timeout",
                    env.timeInterval()
                );
            }
            if (LOG.isTraceEnabled()) {
                LOG.trace("Quiescent after {} step(s), {} warning(s), {} payment(s)", steps, warnings.size(), payments.size());
            }
            return new ReduceResult(steps > 0, warnings, payments, state, contract);
        }
    }

    private ReduceStepResult refundOne(State state) {
        var accounts = state.accounts();
        if (accounts.isEmpty()) {
            return ReduceStepResult.NOT_REDUCED;
        }
        var key = accounts.firstKey();
        var amount = accounts.get(key);
        var payment = new Payment(key.owner(), Payee.party(key.owner()), key.token(), amount);
        return reduced(Optional.empty(), Optional.of(payment), state.withoutAccount(key), Contract.CLOSE);
    }

    private ReduceStepResult pay(Environment env, State state, Contract.Pay pay) {
        var requested = Evaluator.evalValue(env, state, pay.amount());
        if (requested.signum() <= 0) {
            var warning = new TransactionWarning.NonPositivePay(pay.fromAccount(), pay.payee(), pay.token(), requested);
            return reduced(Optional.of(warning), Optional.empty(), state, pay.then());
        }
        BigInteger balance = state.moneyInAccount(pay.fromAccount(), pay.token());
        BigInteger paid = Arithmetic.min(balance, requested);
        Optional<TransactionWarning> warning = paid.compareTo(requested) < 0
            ? Optional.of(new TransactionWarning.PartialPay(pay.fromAccount(), pay.payee(), pay.token(), paid, requested))
            : Optional.empty();
        var debited = state.withBalance(pay.fromAccount(), pay.token(), balance.subtract(paid));
        if (pay.payee() instanceof Payee.Account target) {
            return reduced(warning, Optional.empty(), debited.addMoney(target.party(), pay.token(), paid), pay.then());
        }
        Optional<Payment> payment = paid.signum() > 0
            ? Optional.of(new Payment(pay.fromAccount(), pay.payee(), pay.token(), paid))
            : Optional.empty();
        return reduced(warning, payment, debited, pay.then());
    }

    private static ReduceStepResult reduced(
        Optional<TransactionWarning> warning,
        Optional<Payment> payment,
        State state,
        Contract continuation
    ) {
        return new ReduceStepResult.Reduced(warning, payment, state, continuation);
    }
}
