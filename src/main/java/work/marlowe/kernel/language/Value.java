package work.marlowe.kernel.language;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Integer expression of the contract language.
 */
public sealed interface Value
    permits Value.Constant, Value.AvailableMoney, Value.Negate, Value.Add, Value.Sub, Value.Mul, Value.Div,
    Value.ChoiceValue, Value.TimeIntervalStart, Value.TimeIntervalEnd, Value.UseValue, Value.Cond {

    static Value constant(long value) {
        return new Constant(BigInteger.valueOf(value));
    }

    static Value constant(BigInteger value) {
        return new Constant(value);
    }

    static Value availableMoney(Party account, Token token) {
        return new AvailableMoney(account, token);
    }

    static Value useValue(String name) {
        return new UseValue(ValueId.of(name));
    }

    record Constant(BigInteger value) implements Value {
        public Constant {
            Objects.requireNonNull(value, "value");
        }
    }

    /** Balance of {@code token} in the account owned by {@code account}. */
    record AvailableMoney(Party account, Token token) implements Value {
        public AvailableMoney {
            Objects.requireNonNull(account, "account");
            Objects.requireNonNull(token, "token");
        }
    }

    record Negate(Value value) implements Value {
        public Negate {
            Objects.requireNonNull(value, "value");
        }
    }

    record Add(Value left, Value right) implements Value {
        public Add {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record Sub(Value left, Value right) implements Value {
        public Sub {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record Mul(Value left, Value right) implements Value {
        public Mul {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record Div(Value dividend, Value divisor) implements Value {
        public Div {
            Objects.requireNonNull(dividend, "dividend");
            Objects.requireNonNull(divisor, "divisor");
        }
    }

    record ChoiceValue(ChoiceId choiceId) implements Value {
        public ChoiceValue {
            Objects.requireNonNull(choiceId, "choiceId");
        }
    }

    record TimeIntervalStart() implements Value {}

    record TimeIntervalEnd() implements Value {}

    record UseValue(ValueId valueId) implements Value {
        public UseValue {
            Objects.requireNonNull(valueId, "valueId");
        }
    }

    record Cond(Observation condition, Value then, Value otherwise) implements Value {
        public Cond {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(then, "then");
            Objects.requireNonNull(otherwise, "otherwise");
        }
    }
}
