package work.marlowe.kernel.language;

import java.math.BigInteger;
import java.util.Objects;

/**
 * What a participant does in a transaction, independently of how the matched continuation is disclosed.
 */
public sealed interface InputContent permits InputContent.INotify, InputContent.IDeposit, InputContent.IChoice {

    InputContent NOTIFY = new INotify();

    record INotify() implements InputContent {}

    record IDeposit(Party intoAccount, Party party, Token token, BigInteger quantity) implements InputContent {
        public IDeposit {
            Objects.requireNonNull(intoAccount, "intoAccount");
            Objects.requireNonNull(party, "party");
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(quantity, "quantity");
        }
    }

    record IChoice(ChoiceId choiceId, BigInteger chosenNum) implements InputContent {
        public IChoice {
            Objects.requireNonNull(choiceId, "choiceId");
            Objects.requireNonNull(chosenNum, "chosenNum");
        }
    }
}
