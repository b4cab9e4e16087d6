package work.marlowe.kernel.semantics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.marlowe.kernel.support.ContractFixtures.ADA;
import static work.marlowe.kernel.support.ContractFixtures.ALICE;
import static work.marlowe.kernel.support.ContractFixtures.BOB;
import static work.marlowe.kernel.support.ContractFixtures.CAROL;
import static work.marlowe.kernel.support.ContractFixtures.DOLLAR;
import static work.marlowe.kernel.support.ContractFixtures.depositThenClose;

import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.marlowe.kernel.language.Contract;
import work.marlowe.kernel.language.Contracts;
import work.marlowe.kernel.language.Observation;
import work.marlowe.kernel.language.Payee;
import work.marlowe.kernel.language.Value;
import work.marlowe.kernel.language.ValueId;

class ReductionTest {
    private final Semantics semantics = Semantics.create();

    @Test
    void capsPaymentAtTheAvailableBalance() {
        var state = State.empty(0).withBalance(ALICE, ADA, big(30));
        var pay = new Contract.Pay(ALICE, Payee.party(BOB), ADA, Value.constant(50), Contract.CLOSE);

        var result = semantics.reduceContractUntilQuiescent(Environment.of(0, 10), state, pay);

        assertEquals(List.of(new TransactionWarning.PartialPay(ALICE, Payee.party(BOB), ADA, big(30), big(50))),
            result.warnings());
        assertEquals(List.of(new Payment(ALICE, Payee.party(BOB), ADA, big(30))), result.payments());
        assertEquals(BigInteger.ZERO, result.state().moneyInAccount(ALICE, ADA));
        assertEquals(Contract.CLOSE, result.continuation());
    }

    @Test
    void nonPositivePayMovesNothing() {
        var state = State.empty(0).withBalance(ALICE, ADA, big(30));
        var pay = new Contract.Pay(ALICE, Payee.party(BOB), ADA, Value.constant(-5), Contract.CLOSE);

        var step = semantics.reduceContractStep(Environment.of(0, 10), state, pay);

        var reduced = assertInstanceOf(ReduceStepResult.Reduced.class, step);
        assertEquals(new TransactionWarning.NonPositivePay(ALICE, Payee.party(BOB), ADA, big(-5)),
            reduced.warning().orElseThrow());
        assertTrue(reduced.payment().isEmpty());
        assertEquals(state, reduced.state());
    }

    @Test
    void paymentToAnAccountStaysInside() {
        var state = State.empty(0).withBalance(ALICE, ADA, big(30));
        var pay = new Contract.Pay(ALICE, Payee.account(BOB), ADA, Value.constant(20),
            new Contract.When(List.of(), 100, Contract.CLOSE));

        var result = semantics.reduceContractUntilQuiescent(Environment.of(0, 10), state, pay);

        assertTrue(result.payments().isEmpty());
        assertEquals(big(10), result.state().moneyInAccount(ALICE, ADA));
        assertEquals(big(20), result.state().moneyInAccount(BOB, ADA));
        assertEquals(big(30), result.state().totalBalance(ADA));
    }

    @Test
    void closeRefundsAccountsInKeyOrder() {
        var state = State.empty(0)
            .withBalance(BOB, ADA, big(5))
            .withBalance(ALICE, DOLLAR, big(7))
            .withBalance(CAROL, ADA, big(3))
            .withBalance(ALICE, ADA, big(2));

        var result = semantics.reduceContractUntilQuiescent(Environment.of(0, 0), state, Contract.CLOSE);

        assertEquals(List.of(
            new Payment(CAROL, Payee.party(CAROL), ADA, big(3)),
            new Payment(ALICE, Payee.party(ALICE), ADA, big(2)),
            new Payment(ALICE, Payee.party(ALICE), DOLLAR, big(7)),
            new Payment(BOB, Payee.party(BOB), ADA, big(5))
        ), result.payments());
        assertTrue(result.state().accounts().isEmpty());
        assertTrue(result.reduced());
    }

    @Test
    void closeWithEmptyAccountsIsQuiescent() {
        var step = semantics.reduceContractStep(Environment.of(0, 0), State.empty(0), Contract.CLOSE);
        assertEquals(ReduceStepResult.NOT_REDUCED, step);

        var result = semantics.reduceContractUntilQuiescent(Environment.of(0, 0), State.empty(0), Contract.CLOSE);
        assertFalse(result.reduced());
        assertTrue(result.payments().isEmpty());
    }

    @Test
    void whenWaitsBeforeItsTimeout() {
        var when = depositThenClose(ALICE, 100, 1000);
        assertEquals(ReduceStepResult.NOT_REDUCED,
            semantics.reduceContractStep(Environment.of(999, 999), State.empty(0), when));
    }

    @Test
    void whenTimesOutAtItsTimeout() {
        var when = depositThenClose(ALICE, 100, 1000);
        var step = semantics.reduceContractStep(Environment.of(1000, 1000), State.empty(0), when);
        var reduced = assertInstanceOf(ReduceStepResult.Reduced.class, step);
        assertEquals(Contract.CLOSE, reduced.continuation());
    }

    @Test
    void intervalStraddlingTheTimeoutIsAmbiguous() {
        var when = depositThenClose(ALICE, 100, 1000);
        assertEquals(ReduceStepResult.AMBIGUOUS_TIME_INTERVAL,
            semantics.reduceContractStep(Environment.of(999, 1000), State.empty(0), when));

        var error = assertThrows(TransactionException.class,
            () -> semantics.reduceContractUntilQuiescent(Environment.of(999, 1000), State.empty(0), when));
        assertEquals(TransactionError.AMBIGUOUS_TIME_INTERVAL, error.error());
    }

    @Test
    void ifFollowsTheObservation() {
        var contract = new Contract.If(
            new Observation.ValueGT(new Value.TimeIntervalStart(), Value.constant(50)),
            new Contract.Let(ValueId.of("late"), Value.constant(1), new Contract.When(List.of(), 500, Contract.CLOSE)),
            new Contract.When(List.of(), 500, Contract.CLOSE)
        );

        var early = semantics.reduceContractUntilQuiescent(Environment.of(10, 20), State.empty(0), contract);
        var late = semantics.reduceContractUntilQuiescent(Environment.of(60, 70), State.empty(0), contract);

        assertTrue(early.state().boundValue(ValueId.of("late")).isEmpty());
        assertEquals(big(1), late.state().boundValue(ValueId.of("late")).orElseThrow());
    }

    @Test
    void rebindingWithADifferentValueWarns() {
        var id = ValueId.of("x");
        var contract = new Contract.Let(id, Value.constant(1),
            new Contract.Let(id, Value.constant(1),
                new Contract.Let(id, Value.constant(2), Contract.CLOSE)));

        var result = semantics.reduceContractUntilQuiescent(Environment.of(0, 0), State.empty(0), contract);

        assertEquals(List.of(new TransactionWarning.Shadowing(id, big(1), big(2))), result.warnings());
        assertEquals(big(2), result.state().boundValue(id).orElseThrow());
    }

    @Test
    void failedAssertionWarnsAndContinues() {
        var contract = new Contract.Assert(Observation.FALSE, new Contract.Assert(Observation.TRUE, Contract.CLOSE));

        var result = semantics.reduceContractUntilQuiescent(Environment.of(0, 0), State.empty(0), contract);

        assertEquals(List.of(TransactionWarning.ASSERTION_FAILED), result.warnings());
        assertEquals(Contract.CLOSE, result.continuation());
    }

    @Test
    void quiescenceIsIdempotent() {
        var state = State.empty(0).withBalance(ALICE, ADA, big(40));
        var contract = new Contract.Pay(ALICE, Payee.account(BOB), ADA, Value.constant(15),
            depositThenClose(BOB, 5, 900));
        var env = Environment.of(0, 10);

        var first = semantics.reduceContractUntilQuiescent(env, state, contract);
        var second = semantics.reduceContractUntilQuiescent(env, first.state(), first.continuation());

        assertTrue(first.reduced());
        assertFalse(second.reduced());
        assertTrue(second.warnings().isEmpty());
        assertTrue(second.payments().isEmpty());
        assertEquals(first.state(), second.state());
        assertEquals(first.continuation(), second.continuation());
    }

    @Test
    void reductionIsDeterministic() {
        var state = State.empty(0).withBalance(ALICE, ADA, big(40)).withBalance(BOB, ADA, big(1));
        var contract = new Contract.Pay(ALICE, Payee.party(CAROL), ADA, Value.constant(50), Contract.CLOSE);
        var env = Environment.of(0, 10);

        assertEquals(
            semantics.reduceContractUntilQuiescent(env, state, contract),
            semantics.reduceContractUntilQuiescent(env, state, contract)
        );
    }

    @Test
    void moneyIsConserved() {
        var state = State.empty(0).withBalance(ALICE, ADA, big(40)).withBalance(BOB, ADA, big(9));
        var contract = new Contract.Pay(ALICE, Payee.account(BOB), ADA, Value.constant(15),
            new Contract.Pay(BOB, Payee.party(CAROL), ADA, Value.constant(100), Contract.CLOSE));

        var result = semantics.reduceContractUntilQuiescent(Environment.of(0, 10), state, contract);

        var paidOut = result.payments().stream().map(Payment::amount).reduce(BigInteger.ZERO, BigInteger::add);
        assertEquals(state.totalBalance(ADA), result.state().totalBalance(ADA).add(paidOut));
    }

    @Test
    void stepBudgetStopsLongReductions() {
        Contract contract = Contract.CLOSE;
        for (int i = 0; i < 20; i++) {
            contract = new Contract.Assert(Observation.TRUE, contract);
        }
        var bounded = Semantics.builder().maxSteps(10).build();
        var chain = contract;

        var error = assertThrows(TransactionException.class,
            () -> bounded.reduceContractUntilQuiescent(Environment.of(0, 0), State.empty(0), chain));
        assertEquals(TransactionError.STEP_LIMIT_EXCEEDED, error.error());
        assertEquals(10, bounded.maxSteps());
    }

    @Test
    void reductionStepsAreBoundedByContractSizeAndAccounts() {
        Contract contract = new Contract.When(List.of(), 5, Contract.CLOSE);
        for (int i = 0; i < 30; i++) {
            contract = new Contract.Let(ValueId.of("v" + i), Value.constant(i), contract);
        }
        var state = State.empty(0).withBalance(ALICE, ADA, big(1)).withBalance(BOB, ADA, big(1));
        var budget = Contracts.size(contract) + state.accounts().size();
        var bounded = Semantics.builder().maxSteps(budget).build();

        var result = bounded.reduceContractUntilQuiescent(Environment.of(10, 10), state, contract);

        assertEquals(Contract.CLOSE, result.continuation());
        assertTrue(result.state().accounts().isEmpty());
    }

    @Test
    void deepContractsReduceWithoutOverflow() {
        Contract contract = Contract.CLOSE;
        for (int i = 0; i < 100_000; i++) {
            contract = new Contract.Assert(Observation.TRUE, contract);
        }
        var result = semantics.reduceContractUntilQuiescent(Environment.of(0, 0), State.empty(0), contract);
        assertEquals(Contract.CLOSE, result.continuation());
    }

    private static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }
}
