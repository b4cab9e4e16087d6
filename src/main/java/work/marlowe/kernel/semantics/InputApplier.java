package work.marlowe.kernel.semantics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.marlowe.kernel.language.Action;
import work.marlowe.kernel.language.Bound;
import work.marlowe.kernel.language.Case;
import work.marlowe.kernel.language.Contract;
import work.marlowe.kernel.language.Input;
import work.marlowe.kernel.language.InputContent;

/**
 * Matches external inputs against the cases of a waiting {@code When}.
 */
final class InputApplier {
    private static final Logger LOG = LoggerFactory.getLogger(InputApplier.class);

    private final Reducer reducer;
    private final ContinuationHasher hasher;

    InputApplier(Reducer reducer, ContinuationHasher hasher) {
        this.reducer = reducer;
        this.hasher = hasher;
    }

    ApplyResult applyInput(Environment env, State state, Contract contract, Input input) {
        if (!(contract instanceof Contract.When when)) {
            throw new TransactionException(
                TransactionError.MALFORMED_CALL,
                "Inputs can only be applied to a waiting When, got " + contract.getClass().getSimpleName()
            );
        }
        var pending = reducer.step(env, state, when);
        if (pending instanceof ReduceStepResult.AmbiguousTimeInterval) {
            throw new TransactionException(
                TransactionError.AMBIGUOUS_TIME_INTERVAL,
                "Time interval straddles the timeout " + when.timeout(),
                env.timeInterval()
            );
        }
        if (!(pending instanceof ReduceStepResult.NotReduced)) {
            throw new TransactionException(
                TransactionError.MALFORMED_CALL,
                "When timed out at " + when.timeout() + "; reduce the contract before applying inputs"
            );
        }

        var cases = when.cases();
        for (int index = 0; index < cases.size(); index++) {
            var candidate = cases.get(index);
            var applied = applyAction(env, state, input.content(), candidate.action());
            if (applied.isEmpty()) {
                continue;
            }
            var continuation = continuation(input, candidate, index);
            LOG.debug("Input {} matched case #{}", input.content().getClass().getSimpleName(), index);
            var quiescent = reducer.untilQuiescent(env, applied.get().state(), continuation);
            var warnings = new ArrayList<TransactionWarning>();
            applied.get().warning().ifPresent(warnings::add);
            warnings.addAll(quiescent.warnings());
            return new ApplyResult(warnings, quiescent.payments(), quiescent.state(), quiescent.continuation());
        }
        throw new TransactionException(
            TransactionError.APPLY_NO_MATCH,
            "Input does not match any case of the current When",
            Map.of("cases", cases.size())
        );
    }

    ApplyAllResult applyAllInputs(Environment env, State state, Contract contract, List<Input> inputs) {
        var first = reducer.untilQuiescent(env, state, contract);
        var warnings = new ArrayList<>(first.warnings());
        var payments = new ArrayList<>(first.payments());
        var currentState = first.state();
        var currentContract = first.continuation();
        boolean changed = first.reduced();
        for (Input input : inputs) {
            if (!(currentContract instanceof Contract.When)) {
                throw new TransactionException(
                    TransactionError.APPLY_NO_MATCH,
                    "Input given to a contract that no longer waits for inputs"
                );
            }
            var applied = applyInput(env, currentState, currentContract, input);
            warnings.addAll(applied.warnings());
            payments.addAll(applied.payments());
            currentState = applied.state();
            currentContract = applied.continuation();
            changed = true;
        }
        return new ApplyAllResult(changed, warnings, payments, currentState, currentContract);
    }

    private Optional<AppliedAction> applyAction(Environment env, State state, InputContent content, Action action) {
        if (action instanceof Action.Deposit deposit && content instanceof InputContent.IDeposit input) {
            var expected = Evaluator.evalValue(env, state, deposit.amount());
            boolean matches = deposit.intoAccount().equals(input.intoAccount())
                && deposit.party().equals(input.party())
                && deposit.token().equals(input.token())
                && expected.equals(input.quantity());
            if (!matches) {
                return Optional.empty();
            }
            Optional<TransactionWarning> warning = input.quantity().signum() > 0
                ? Optional.empty()
                : Optional.of(new TransactionWarning.NonPositiveDeposit(
                    input.party(), input.intoAccount(), input.token(), input.quantity()));
            var credited = state.addMoney(input.intoAccount(), input.token(), input.quantity());
            return Optional.of(new AppliedAction(warning, credited));
        }
        if (action instanceof Action.Choice choice && content instanceof InputContent.IChoice input) {
            if (!choice.choiceId().equals(input.choiceId()) || !Bound.inBounds(input.chosenNum(), choice.bounds())) {
                return Optional.empty();
            }
            return Optional.of(new AppliedAction(Optional.empty(), state.withChoice(input.choiceId(), input.chosenNum())));
        }
        if (action instanceof Action.Notify notify && content instanceof InputContent.INotify) {
            if (!Evaluator.evalObservation(env, state, notify.observation())) {
                return Optional.empty();
            }
            return Optional.of(new AppliedAction(Optional.empty(), state));
        }
        return Optional.empty();
    }

    private Contract continuation(Input input, Case matched, int index) {
        if (input instanceof Input.Normal && matched instanceof Case.Inline inline) {
            return inline.then();
        }
        if (input instanceof Input.Merkleized disclosed && matched instanceof Case.Merkleized merkleized) {
            var expected = merkleized.continuationHash();
            if (!expected.equals(disclosed.continuationHash())) {
                throw hashMismatch(index, expected, disclosed.continuationHash());
            }
            if (hasher != null) {
                var actual = hasher.hash(disclosed.continuation());
                if (!expected.equals(actual)) {
                    throw hashMismatch(index, expected, actual);
                }
            }
            return disclosed.continuation();
        }
        var message = input instanceof Input.Merkleized
            ? "Merkleized input given for an inline case #" + index
            : "Case #" + index + " is merkleized but its continuation was not disclosed";
        throw new TransactionException(TransactionError.HASH_MISMATCH, message, Map.of("case", index));
    }

    private static TransactionException hashMismatch(int index, String expected, String actual) {
        return new TransactionException(
            TransactionError.HASH_MISMATCH,
            "Continuation hash mismatch for case #" + index,
            Map.of("case", index, "expected", expected, "actual", String.valueOf(actual))
        );
    }

    private record AppliedAction(Optional<TransactionWarning> warning, State state) {}
}
