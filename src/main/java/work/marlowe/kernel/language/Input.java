package work.marlowe.kernel.language;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Transaction input. A merkleized input also discloses the continuation of the case it targets, together with the
 * hash the case recorded for it.
 */
public sealed interface Input permits Input.Normal, Input.Merkleized {

    InputContent content();

    static Input notifyInput() {
        return new Normal(InputContent.NOTIFY);
    }

    static Input deposit(Party intoAccount, Party party, Token token, BigInteger quantity) {
        return new Normal(new InputContent.IDeposit(intoAccount, party, token, quantity));
    }

    static Input deposit(Party intoAccount, Party party, Token token, long quantity) {
        return deposit(intoAccount, party, token, BigInteger.valueOf(quantity));
    }

    static Input choice(ChoiceId choiceId, BigInteger chosenNum) {
        return new Normal(new InputContent.IChoice(choiceId, chosenNum));
    }

    static Input choice(ChoiceId choiceId, long chosenNum) {
        return choice(choiceId, BigInteger.valueOf(chosenNum));
    }

    record Normal(InputContent content) implements Input {
        public Normal {
            Objects.requireNonNull(content, "content");
        }
    }

    record Merkleized(InputContent content, String continuationHash, Contract continuation) implements Input {
        public Merkleized {
            Objects.requireNonNull(content, "content");
            Objects.requireNonNull(continuationHash, "continuationHash");
            Objects.requireNonNull(continuation, "continuation");
        }
    }
}
