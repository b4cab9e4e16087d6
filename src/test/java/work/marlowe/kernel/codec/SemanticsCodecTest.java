package work.marlowe.kernel.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.marlowe.kernel.support.ContractFixtures.ADA;
import static work.marlowe.kernel.support.ContractFixtures.ALICE;
import static work.marlowe.kernel.support.ContractFixtures.BOB;
import static work.marlowe.kernel.support.ContractFixtures.resource;

import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.marlowe.kernel.language.Input;
import work.marlowe.kernel.language.Payee;
import work.marlowe.kernel.language.ValueId;
import work.marlowe.kernel.semantics.Payment;
import work.marlowe.kernel.semantics.State;
import work.marlowe.kernel.semantics.TransactionError;
import work.marlowe.kernel.semantics.TransactionException;
import work.marlowe.kernel.semantics.TransactionWarning;

class SemanticsCodecTest {
    @Test
    void decodesTheFundedState() {
        var state = SemanticsCodec.decodeState(MarloweJson.read(resource("states", "funded.json")));
        assertEquals(BigInteger.valueOf(100), state.moneyInAccount(ALICE, ADA));
        assertEquals(BigInteger.TEN, state.minTime());
        assertEquals(state, SemanticsCodec.decodeState(SemanticsCodec.encodeState(state)));
    }

    @Test
    void stateOmitsZeroBalances() {
        var node = MarloweJson.parse("{\"accounts\": [[[{\"role_token\": \"bob\"}, "
            + "{\"currency_symbol\": \"\", \"token_name\": \"\"}], 0]], \"minTime\": 5}");
        var state = SemanticsCodec.decodeState(node);
        assertEquals(State.empty(5), state);
    }

    @Test
    void rejectsNegativeBalances() {
        var node = MarloweJson.parse("{\"accounts\": [[[{\"role_token\": \"bob\"}, "
            + "{\"currency_symbol\": \"\", \"token_name\": \"\"}], -1]], \"minTime\": 5}");
        assertThrows(CodecException.class, () -> SemanticsCodec.decodeState(node));
    }

    @Test
    void encodesWarnings() {
        var partial = SemanticsCodec.encodeWarning(new TransactionWarning.PartialPay(
            ALICE, Payee.party(BOB), ADA, BigInteger.valueOf(30), BigInteger.valueOf(50)));
        assertEquals(BigInteger.valueOf(50), partial.get("asPayment").bigIntegerValue());
        assertEquals(BigInteger.valueOf(30), partial.get("but_only_paid").bigIntegerValue());
        assertEquals("bob", partial.get("to_payee").get("party").get("role_token").asText());

        var shadowing = SemanticsCodec.encodeWarning(new TransactionWarning.Shadowing(
            ValueId.of("x"), BigInteger.ONE, BigInteger.TWO));
        assertEquals("x", shadowing.get("value_id").asText());
        assertEquals("assertion_failed", SemanticsCodec.encodeWarning(TransactionWarning.ASSERTION_FAILED).asText());
    }

    @Test
    void encodesPayments() {
        var node = SemanticsCodec.encodePayment(new Payment(ALICE, Payee.party(BOB), ADA, BigInteger.TEN));
        assertEquals("alice", node.get("payment_from").get("role_token").asText());
        assertEquals(BigInteger.TEN, node.get("amount").bigIntegerValue());
    }

    @Test
    void decodesTransactions() {
        var node = MarloweJson.parse("[{\"tx_interval\": {\"from\": 1, \"to\": 2}, \"tx_inputs\": [\"input_notify\"]}]");
        var transactions = SemanticsCodec.decodeTransactions(node);
        assertEquals(1, transactions.size());
        assertEquals(BigInteger.TWO, transactions.get(0).interval().to());
        assertEquals(List.of(Input.notifyInput()), transactions.get(0).inputs());
    }

    @Test
    void encodesErrors() {
        var node = SemanticsCodec.encodeError(
            new TransactionException(TransactionError.APPLY_NO_MATCH, "no case"));
        assertEquals("TEApplyNoMatchError", node.get("error").asText());
        assertEquals("apply_no_match", node.get("reason").asText());
        assertEquals("no case", node.get("message").asText());
    }
}
