package work.marlowe.kernel.language;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Contract of the language. Every variant except {@link Close} carries its continuation(s), so a contract is a
 * finite tree.
 */
public sealed interface Contract
    permits Contract.Close, Contract.Pay, Contract.If, Contract.When, Contract.Let, Contract.Assert {

    Contract CLOSE = new Close();

    record Close() implements Contract {}

    record Pay(Party fromAccount, Payee payee, Token token, Value amount, Contract then) implements Contract {
        public Pay {
            Objects.requireNonNull(fromAccount, "fromAccount");
            Objects.requireNonNull(payee, "payee");
            Objects.requireNonNull(token, "token");
            Objects.requireNonNull(amount, "amount");
            Objects.requireNonNull(then, "then");
        }
    }

    record If(Observation condition, Contract then, Contract otherwise) implements Contract {
        public If {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(then, "then");
            Objects.requireNonNull(otherwise, "otherwise");
        }
    }

    /** Waits for one of {@code cases} until {@code timeout} (POSIX milliseconds), then continues with {@code timeoutContinuation}. */
    record When(List<Case> cases, BigInteger timeout, Contract timeoutContinuation) implements Contract {
        public When {
            cases = List.copyOf(cases);
            Objects.requireNonNull(timeout, "timeout");
            Objects.requireNonNull(timeoutContinuation, "timeoutContinuation");
        }

        public When(List<Case> cases, long timeout, Contract timeoutContinuation) {
            this(cases, BigInteger.valueOf(timeout), timeoutContinuation);
        }
    }

    record Let(ValueId valueId, Value value, Contract then) implements Contract {
        public Let {
            Objects.requireNonNull(valueId, "valueId");
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(then, "then");
        }
    }

    record Assert(Observation observation, Contract then) implements Contract {
        public Assert {
            Objects.requireNonNull(observation, "observation");
            Objects.requireNonNull(then, "then");
        }
    }
}
