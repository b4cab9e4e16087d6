package work.marlowe.kernel.language;

import java.util.Objects;

/**
 * Boolean expression of the contract language.
 */
public sealed interface Observation
    permits Observation.And, Observation.Or, Observation.Not, Observation.ChoseSomething, Observation.ValueGE,
    Observation.ValueGT, Observation.ValueLT, Observation.ValueLE, Observation.ValueEQ, Observation.True,
    Observation.False {

    Observation TRUE = new True();
    Observation FALSE = new False();

    record And(Observation left, Observation right) implements Observation {
        public And {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record Or(Observation left, Observation right) implements Observation {
        public Or {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record Not(Observation observation) implements Observation {
        public Not {
            Objects.requireNonNull(observation, "observation");
        }
    }

    record ChoseSomething(ChoiceId choiceId) implements Observation {
        public ChoseSomething {
            Objects.requireNonNull(choiceId, "choiceId");
        }
    }

    record ValueGE(Value left, Value right) implements Observation {
        public ValueGE {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record ValueGT(Value left, Value right) implements Observation {
        public ValueGT {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record ValueLT(Value left, Value right) implements Observation {
        public ValueLT {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record ValueLE(Value left, Value right) implements Observation {
        public ValueLE {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record ValueEQ(Value left, Value right) implements Observation {
        public ValueEQ {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record True() implements Observation {}

    record False() implements Observation {}
}
