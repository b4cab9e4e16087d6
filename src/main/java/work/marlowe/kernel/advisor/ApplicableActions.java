package work.marlowe.kernel.advisor;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.marlowe.kernel.language.Action;
import work.marlowe.kernel.language.Case;
import work.marlowe.kernel.language.Contract;
import work.marlowe.kernel.language.Contracts;
import work.marlowe.kernel.language.Input;
import work.marlowe.kernel.language.InputContent;
import work.marlowe.kernel.runtime.ContinuationResolver;
import work.marlowe.kernel.semantics.Environment;
import work.marlowe.kernel.semantics.ReduceResult;
import work.marlowe.kernel.semantics.Semantics;
import work.marlowe.kernel.semantics.State;
import work.marlowe.kernel.semantics.TimeInterval;

/**
 * Lists what can be done to a contract in a given environment. Each case of the waiting {@code When} is probed
 * with the input that would match it; the returned actions compute their outcome lazily.
 */
public final class ApplicableActions {
    private static final Logger LOG = LoggerFactory.getLogger(ApplicableActions.class);

    private final Semantics semantics;
    private final ContinuationResolver resolver;

    public ApplicableActions(Semantics semantics, ContinuationResolver resolver) {
        this.semantics = Objects.requireNonNull(semantics, "semantics");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Environment an advisor uses when the caller gives none: from {@code now} up to one millisecond before the
     * next timeout, or before {@code now + window} when nothing times out any more.
     */
    public static Environment defaultEnvironment(Contract contract, BigInteger now, Duration window) {
        var end = Contracts.nextTimeout(contract, now)
            .orElseGet(() -> now.add(BigInteger.valueOf(window.toMillis())));
        return new Environment(new TimeInterval(now, end.subtract(BigInteger.ONE)));
    }

    public List<ApplicableAction> compute(Environment env, State state, Contract contract) {
        var initial = semantics.reduceContractUntilQuiescent(env, state, contract);
        var actions = new ArrayList<ApplicableAction>();
        if (initial.reduced()) {
            actions.add(new ApplicableAction.AdvanceTimeout(() -> applied(env, initial, List.of())));
        }
        if (!(initial.continuation() instanceof Contract.When when)) {
            return actions;
        }
        var reducedState = initial.state();
        for (Case candidate : when.cases()) {
            var action = candidate.action();
            if (action instanceof Action.Deposit deposit) {
                var amount = semantics.evalValue(env, reducedState, deposit.amount());
                var content = new InputContent.IDeposit(deposit.intoAccount(), deposit.party(), deposit.token(), amount);
                actions.add(new ApplicableAction.CanDeposit(
                    deposit, amount, () -> applied(env, initial, List.of(input(candidate, content)))));
            } else if (action instanceof Action.Choice choice) {
                actions.add(new ApplicableAction.CanChoose(choice, chosen -> applied(
                    env, initial, List.of(input(candidate, new InputContent.IChoice(choice.choiceId(), chosen))))));
            } else if (action instanceof Action.Notify notify) {
                if (semantics.evalObservation(env, reducedState, notify.observation())) {
                    actions.add(new ApplicableAction.CanNotify(
                        notify, () -> applied(env, initial, List.of(input(candidate, InputContent.NOTIFY)))));
                }
            } else {
                throw new IllegalStateException("Unknown action: " + action);
            }
        }
        LOG.debug("{} applicable action(s) at {}..{}", actions.size(), env.timeInterval().from(), env.timeInterval().to());
        return actions;
    }

    /**
     * Merkleized cases are resolved only when the action is applied.
     */
    private Input input(Case candidate, InputContent content) {
        if (candidate instanceof Case.Merkleized merkleized) {
            var hash = merkleized.continuationHash();
            return new Input.Merkleized(content, hash, resolver.require(hash));
        }
        return new Input.Normal(content);
    }

    private AppliedAction applied(Environment env, ReduceResult initial, List<Input> inputs) {
        var result = semantics.applyAllInputs(env, initial.state(), initial.continuation(), inputs);
        var warnings = new ArrayList<>(initial.warnings());
        warnings.addAll(result.warnings());
        var payments = new ArrayList<>(initial.payments());
        payments.addAll(result.payments());
        return new AppliedAction(inputs, env, result.state(), result.continuation(), warnings, payments);
    }
}
