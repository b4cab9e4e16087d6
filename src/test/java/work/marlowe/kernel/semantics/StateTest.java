package work.marlowe.kernel.semantics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.marlowe.kernel.support.ContractFixtures.ADA;
import static work.marlowe.kernel.support.ContractFixtures.ALICE;

import java.math.BigInteger;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;

class StateTest {
    @Test
    void zeroBalancesAreNotStored() {
        var state = State.empty(0).withBalance(ALICE, ADA, BigInteger.TEN).withBalance(ALICE, ADA, BigInteger.ZERO);
        assertTrue(state.accounts().isEmpty());
    }

    @Test
    void addingNothingKeepsTheState() {
        var state = State.empty(0).withBalance(ALICE, ADA, BigInteger.TEN);
        assertSame(state, state.addMoney(ALICE, ADA, BigInteger.ZERO));
        assertSame(state, state.addMoney(ALICE, ADA, BigInteger.valueOf(-3)));
        assertEquals(BigInteger.valueOf(15), state.addMoney(ALICE, ADA, BigInteger.valueOf(5)).moneyInAccount(ALICE, ADA));
    }

    @Test
    void negativeBalancesAreRejected() {
        var accounts = new TreeMap<AccountKey, BigInteger>();
        accounts.put(new AccountKey(ALICE, ADA), BigInteger.valueOf(-1));
        assertThrows(IllegalArgumentException.class,
            () -> new State(accounts, new TreeMap<>(), new TreeMap<>(), BigInteger.ZERO));
    }

    @Test
    void stateMapsAreReadOnly() {
        var state = State.empty(0).withBalance(ALICE, ADA, BigInteger.TEN);
        assertThrows(UnsupportedOperationException.class,
            () -> state.accounts().put(new AccountKey(ALICE, ADA), BigInteger.ONE));
    }
}
