package work.marlowe.kernel.semantics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.marlowe.kernel.support.ContractFixtures.ADA;
import static work.marlowe.kernel.support.ContractFixtures.ALICE;
import static work.marlowe.kernel.support.ContractFixtures.APPROVE;
import static work.marlowe.kernel.support.ContractFixtures.BOB;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;
import work.marlowe.kernel.language.ChoiceId;
import work.marlowe.kernel.language.Observation;
import work.marlowe.kernel.language.Value;
import work.marlowe.kernel.language.ValueId;

class EvaluatorTest {
    private final Environment env = Environment.of(100, 200);
    private final State state = State.empty(0)
        .withBalance(ALICE, ADA, BigInteger.valueOf(70))
        .withChoice(APPROVE, BigInteger.ONE)
        .withBoundValue(ValueId.of("price"), BigInteger.valueOf(12));

    @Test
    void readsStateAndEnvironment() {
        assertEquals(big(70), eval(Value.availableMoney(ALICE, ADA)));
        assertEquals(big(0), eval(Value.availableMoney(BOB, ADA)));
        assertEquals(big(1), eval(new Value.ChoiceValue(APPROVE)));
        assertEquals(big(12), eval(Value.useValue("price")));
        assertEquals(big(0), eval(Value.useValue("missing")));
        assertEquals(big(100), eval(new Value.TimeIntervalStart()));
        assertEquals(big(200), eval(new Value.TimeIntervalEnd()));
    }

    @Test
    void computesArithmetic() {
        var total = new Value.Add(Value.constant(5), new Value.Mul(Value.constant(3), Value.useValue("price")));
        assertEquals(big(41), eval(total));
        assertEquals(big(-41), eval(new Value.Negate(total)));
        assertEquals(big(-2), eval(new Value.Sub(Value.constant(5), Value.constant(7))));
        assertEquals(big(4), eval(new Value.Div(Value.constant(7), Value.constant(2))));
        assertEquals(big(0), eval(new Value.Div(Value.constant(7), Value.constant(0))));
    }

    @Test
    void evaluatesConditionalValues() {
        var cond = new Value.Cond(
            new Observation.ValueGT(Value.availableMoney(ALICE, ADA), Value.constant(50)),
            Value.constant(1),
            Value.constant(2)
        );
        assertEquals(big(1), eval(cond));
    }

    @Test
    void evaluatesObservations() {
        assertTrue(observe(Observation.TRUE));
        assertFalse(observe(Observation.FALSE));
        assertTrue(observe(new Observation.ChoseSomething(APPROVE)));
        assertFalse(observe(new Observation.Not(new Observation.ChoseSomething(APPROVE))));
        assertTrue(observe(new Observation.And(Observation.TRUE, Observation.TRUE)));
        assertFalse(observe(new Observation.And(Observation.TRUE, Observation.FALSE)));
        assertTrue(observe(new Observation.Or(Observation.FALSE, Observation.TRUE)));
        assertTrue(observe(new Observation.ValueGE(Value.constant(3), Value.constant(3))));
        assertFalse(observe(new Observation.ValueGT(Value.constant(3), Value.constant(3))));
        assertTrue(observe(new Observation.ValueLT(Value.constant(2), Value.constant(3))));
        assertTrue(observe(new Observation.ValueLE(Value.constant(3), Value.constant(3))));
        assertTrue(observe(new Observation.ValueEQ(Value.useValue("price"), Value.constant(12))));
    }

    @Test
    void unchosenChoiceIsNotSomething() {
        var other = new ChoiceId("reject", BOB);
        assertFalse(observe(new Observation.ChoseSomething(other)));
        assertEquals(big(0), eval(new Value.ChoiceValue(other)));
    }

    private BigInteger eval(Value value) {
        return Evaluator.evalValue(env, state, value);
    }

    private boolean observe(Observation observation) {
        return Evaluator.evalObservation(env, state, observation);
    }

    private static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }
}
