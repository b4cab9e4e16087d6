package work.marlowe.kernel.semantics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.marlowe.kernel.support.ContractFixtures.ADA;
import static work.marlowe.kernel.support.ContractFixtures.ALICE;
import static work.marlowe.kernel.support.ContractFixtures.APPROVE;
import static work.marlowe.kernel.support.ContractFixtures.BOB;
import static work.marlowe.kernel.support.ContractFixtures.depositThenClose;

import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.marlowe.kernel.language.Action;
import work.marlowe.kernel.language.Bound;
import work.marlowe.kernel.language.Case;
import work.marlowe.kernel.language.Contract;
import work.marlowe.kernel.language.Input;
import work.marlowe.kernel.language.Observation;
import work.marlowe.kernel.language.Payee;
import work.marlowe.kernel.language.Value;
import work.marlowe.kernel.language.ValueId;

class TransactionBoundaryTest {
    private final Semantics semantics = Semantics.create();

    @Test
    void rejectsInvertedIntervals() {
        var transaction = new Transaction(TimeInterval.of(20, 10), List.of());
        var error = assertThrows(TransactionException.class,
            () -> semantics.computeTransaction(transaction, State.empty(0), depositThenClose(ALICE, 1, 100)));
        assertEquals(TransactionError.INVALID_INTERVAL, error.error());
        assertEquals("TEIntervalError", error.code());
    }

    @Test
    void rejectsIntervalsInThePast() {
        var transaction = new Transaction(TimeInterval.of(10, 20), List.of(Input.deposit(ALICE, ALICE, ADA, 1)));
        var error = assertThrows(TransactionException.class,
            () -> semantics.computeTransaction(transaction, State.empty(50), depositThenClose(ALICE, 1, 100)));
        assertEquals(TransactionError.INTERVAL_IN_PAST, error.error());
    }

    @Test
    void trimsTheIntervalToTheMinimumTime() {
        var contract = new Contract.When(
            List.of(Case.of(new Action.Notify(Observation.TRUE),
                new Contract.Let(ValueId.of("start"), new Value.TimeIntervalStart(),
                    new Contract.When(List.of(), 900, Contract.CLOSE)))),
            1000,
            Contract.CLOSE
        );
        var transaction = new Transaction(TimeInterval.of(10, 60), List.of(Input.notifyInput()));

        var output = semantics.computeTransaction(transaction, State.empty(40), contract);

        assertEquals(BigInteger.valueOf(40), output.state().minTime());
        assertEquals(BigInteger.valueOf(40),
            output.state().boundValue(ValueId.of("start")).orElseThrow());
    }

    @Test
    void advancesTheMinimumTime() {
        var contract = new Contract.When(
            List.of(Case.of(new Action.Notify(Observation.TRUE), new Contract.When(List.of(), 900, Contract.CLOSE))),
            1000,
            Contract.CLOSE
        );
        var transaction = new Transaction(TimeInterval.of(70, 80), List.of(Input.notifyInput()));

        var output = semantics.computeTransaction(transaction, State.empty(40), contract);

        assertEquals(BigInteger.valueOf(70), output.state().minTime());
    }

    @Test
    void rejectsTransactionsThatChangeNothing() {
        var transaction = new Transaction(TimeInterval.of(0, 10), List.of());
        var error = assertThrows(TransactionException.class,
            () -> semantics.computeTransaction(transaction, State.empty(0), depositThenClose(ALICE, 1, 100)));
        assertEquals(TransactionError.USELESS_TRANSACTION, error.error());

        var closed = assertThrows(TransactionException.class,
            () -> semantics.computeTransaction(transaction, State.empty(0), Contract.CLOSE));
        assertEquals(TransactionError.USELESS_TRANSACTION, closed.error());
    }

    @Test
    void closingWithMoneyIsUseful() {
        var state = State.empty(0).withBalance(ALICE, ADA, BigInteger.TEN);
        var output = semantics.computeTransaction(new Transaction(TimeInterval.of(0, 10), List.of()), state,
            Contract.CLOSE);
        assertEquals(List.of(new Payment(ALICE, Payee.party(ALICE), ADA, BigInteger.TEN)), output.payments());
    }

    @Test
    void playsATraceOfTransactions() {
        var pay = new Contract.If(
            new Observation.ValueEQ(new Value.ChoiceValue(APPROVE), Value.constant(1)),
            new Contract.Pay(ALICE, Payee.party(BOB), ADA, Value.constant(100), Contract.CLOSE),
            Contract.CLOSE
        );
        var approval = new Contract.When(
            List.of(Case.of(new Action.Choice(APPROVE, List.of(Bound.of(0, 1))), pay)), 2000, Contract.CLOSE);
        var contract = new Contract.When(
            List.of(Case.of(new Action.Deposit(ALICE, ALICE, ADA, Value.constant(100)), approval)), 1000,
            Contract.CLOSE);

        var output = semantics.playTrace(BigInteger.ZERO, contract, List.of(
            new Transaction(TimeInterval.of(0, 100), List.of(Input.deposit(ALICE, ALICE, ADA, 100))),
            new Transaction(TimeInterval.of(200, 300), List.of(Input.choice(APPROVE, 1)))
        ));

        assertEquals(List.of(new Payment(ALICE, Payee.party(BOB), ADA, BigInteger.valueOf(100))), output.payments());
        assertTrue(output.warnings().isEmpty());
        assertEquals(Contract.CLOSE, output.contract());
        assertTrue(output.state().accounts().isEmpty());
        assertEquals(BigInteger.valueOf(200), output.state().minTime());
    }

    @Test
    void traceStopsAtTheFirstRejectedTransaction() {
        var contract = depositThenClose(ALICE, 100, 1000);
        var error = assertThrows(TransactionException.class, () -> semantics.playTrace(BigInteger.ZERO, contract,
            List.of(new Transaction(TimeInterval.of(0, 100), List.of(Input.deposit(ALICE, ALICE, ADA, 5))))));
        assertEquals(TransactionError.APPLY_NO_MATCH, error.error());
    }
}
