package work.marlowe.kernel.language;

import java.util.List;
import java.util.Objects;

/**
 * External event a {@code When} case waits for.
 */
public sealed interface Action permits Action.Deposit, Action.Choice, Action.Notify {

    /** {@code party} deposits {@code amount} of {@code token} into the account of {@code intoAccount}. */
    record Deposit(Party intoAccount, Party party, Token token, Value amount) implements Action {
        public Deposit {
            Objects.requireNonNull(intoAccount, "intoAccount");
            Objects.requireNonNull(party, "party");
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(amount, "amount");
        }
    }

    record Choice(ChoiceId choiceId, List<Bound> bounds) implements Action {
        public Choice {
            Objects.requireNonNull(choiceId, "choiceId");
            bounds = List.copyOf(bounds);
        }
    }

    record Notify(Observation observation) implements Action {
        public Notify {
            Objects.requireNonNull(observation, "observation");
        }
    }
}
