package work.marlowe.kernel.semantics;

import java.math.BigInteger;
import work.marlowe.kernel.language.Observation;
import work.marlowe.kernel.language.Value;
import work.marlowe.kernel.shared.Arithmetic;

/**
 * Evaluates values and observations against a state and an environment. Both functions are total: a missing
 * account, choice or binding reads as zero.
 */
public final class Evaluator {
    private Evaluator() {}

    public static BigInteger evalValue(Environment env, State state, Value value) {
        if (value instanceof Value.Constant constant) {
            return constant.value();
        }
        if (value instanceof Value.AvailableMoney money) {
            return state.moneyInAccount(money.account(), money.token());
        }
        if (value instanceof Value.Negate negate) {
            return evalValue(env, state, negate.value()).negate();
        }
        if (value instanceof Value.Add add) {
            return evalValue(env, state, add.left()).add(evalValue(env, state, add.right()));
        }
        if (value instanceof Value.Sub sub) {
            return evalValue(env, state, sub.left()).subtract(evalValue(env, state, sub.right()));
        }
        if (value instanceof Value.Mul mul) {
            return evalValue(env, state, mul.left()).multiply(evalValue(env, state, mul.right()));
        }
        if (value instanceof Value.Div div) {
            var dividend = evalValue(env, state, div.dividend());
            var divisor = evalValue(env, state, div.divisor());
            return Arithmetic.divide(dividend, divisor);
        }
        if (value instanceof Value.ChoiceValue choice) {
            return state.choice(choice.choiceId()).orElse(BigInteger.ZERO);
        }
        if (value instanceof Value.TimeIntervalStart) {
            return env.timeInterval().from();
        }
        if (value instanceof Value.TimeIntervalEnd) {
            return env.timeInterval().to();
        }
        if (value instanceof Value.UseValue use) {
            return state.boundValue(use.valueId()).orElse(BigInteger.ZERO);
        }
        if (value instanceof Value.Cond cond) {
            return evalObservation(env, state, cond.condition())
                ? evalValue(env, state, cond.then())
                : evalValue(env, state, cond.otherwise());
        }
        throw new IllegalStateException("Unknown value: " + value);
    }

    public static boolean evalObservation(Environment env, State state, Observation observation) {
        if (observation instanceof Observation.And and) {
            return evalObservation(env, state, and.left()) && evalObservation(env, state, and.right());
        }
        if (observation instanceof Observation.Or or) {
            return evalObservation(env, state, or.left()) || evalObservation(env, state, or.right());
        }
        if (observation instanceof Observation.Not not) {
            return !evalObservation(env, state, not.observation());
        }
        if (observation instanceof Observation.ChoseSomething chose) {
            return state.choices().containsKey(chose.choiceId());
        }
        if (observation instanceof Observation.ValueGE ge) {
            return compare(env, state, ge.left(), ge.right()) >= 0;
        }
        if (observation instanceof Observation.ValueGT gt) {
            return compare(env, state, gt.left(), gt.right()) > 0;
        }
        if (observation instanceof Observation.ValueLT lt) {
            return compare(env, state, lt.left(), lt.right()) < 0;
        }
        if (observation instanceof Observation.ValueLE le) {
            return compare(env, state, le.left(), le.right()) <= 0;
        }
        if (observation instanceof Observation.ValueEQ eq) {
            return compare(env, state, eq.left(), eq.right()) == 0;
        }
        if (observation instanceof Observation.True) {
            return true;
        }
        if (observation instanceof Observation.False) {
            return false;
        }
        throw new IllegalStateException("Unknown observation: " + observation);
    }

    private static int compare(Environment env, State state, Value left, Value right) {
        return evalValue(env, state, left).compareTo(evalValue(env, state, right));
    }
}
