package work.marlowe.kernel.advisor;

import java.math.BigInteger;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import work.marlowe.kernel.language.Action;
import work.marlowe.kernel.language.Bound;
import work.marlowe.kernel.language.Party;

/**
 * Something a participant (or anybody) can do to the contract right now.
 */
public sealed interface ApplicableAction
    permits ApplicableAction.AdvanceTimeout, ApplicableAction.CanDeposit, ApplicableAction.CanChoose,
    ApplicableAction.CanNotify {

    /**
     * Party entitled to perform the action; empty when anybody may.
     */
    Optional<Party> applicant();

    /** The contract can be moved past an elapsed timeout with a transaction carrying no inputs. */
    final class AdvanceTimeout implements ApplicableAction {
        private final Supplier<AppliedAction> apply;

        AdvanceTimeout(Supplier<AppliedAction> apply) {
            this.apply = apply;
        }

        @Override
        public Optional<Party> applicant() {
            return Optional.empty();
        }

        public AppliedAction applyAction() {
            return apply.get();
        }
    }

    final class CanDeposit implements ApplicableAction {
        private final Action.Deposit deposit;
        private final BigInteger amount;
        private final Supplier<AppliedAction> apply;

        CanDeposit(Action.Deposit deposit, BigInteger amount, Supplier<AppliedAction> apply) {
            this.deposit = deposit;
            this.amount = amount;
            this.apply = apply;
        }

        public Action.Deposit deposit() {
            return deposit;
        }

        /** Quantity the deposit evaluates to in the advisory environment. */
        public BigInteger amount() {
            return amount;
        }

        @Override
        public Optional<Party> applicant() {
            return Optional.of(deposit.party());
        }

        public AppliedAction applyAction() {
            return apply.get();
        }
    }

    final class CanChoose implements ApplicableAction {
        private final Action.Choice choice;
        private final Function<BigInteger, AppliedAction> apply;

        CanChoose(Action.Choice choice, Function<BigInteger, AppliedAction> apply) {
            this.choice = choice;
            this.apply = apply;
        }

        public Action.Choice choice() {
            return choice;
        }

        @Override
        public Optional<Party> applicant() {
            return Optional.of(choice.choiceId().choiceOwner());
        }

        /**
         * @throws IllegalArgumentException if {@code chosenNum} is outside every bound of the choice
         */
        public AppliedAction applyAction(BigInteger chosenNum) {
            if (!Bound.inBounds(chosenNum, choice.bounds())) {
                throw new IllegalArgumentException("Chosen number " + chosenNum + " is not in bounds");
            }
            return apply.apply(chosenNum);
        }
    }

    final class CanNotify implements ApplicableAction {
        private final Action.Notify notify;
        private final Supplier<AppliedAction> apply;

        CanNotify(Action.Notify notify, Supplier<AppliedAction> apply) {
            this.notify = notify;
            this.apply = apply;
        }

        public Action.Notify notification() {
            return notify;
        }

        @Override
        public Optional<Party> applicant() {
            return Optional.empty();
        }

        public AppliedAction applyAction() {
            return apply.get();
        }
    }
}
