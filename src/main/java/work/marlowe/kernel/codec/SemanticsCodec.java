package work.marlowe.kernel.codec;

import static work.marlowe.kernel.codec.LanguageCodec.field;
import static work.marlowe.kernel.codec.LanguageCodec.integer;
import static work.marlowe.kernel.codec.LanguageCodec.requireObject;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeMap;
import work.marlowe.kernel.language.ChoiceId;
import work.marlowe.kernel.language.ValueId;
import work.marlowe.kernel.semantics.AccountKey;
import work.marlowe.kernel.semantics.ApplyAllResult;
import work.marlowe.kernel.semantics.Payment;
import work.marlowe.kernel.semantics.ReduceResult;
import work.marlowe.kernel.semantics.State;
import work.marlowe.kernel.semantics.TimeInterval;
import work.marlowe.kernel.semantics.Transaction;
import work.marlowe.kernel.semantics.TransactionException;
import work.marlowe.kernel.semantics.TransactionOutput;
import work.marlowe.kernel.semantics.TransactionWarning;

/**
 * JSON form of interpreter state and results.
 */
public final class SemanticsCodec {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private SemanticsCodec() {}

    public static State decodeState(JsonNode node) {
        requireObject(node, "state");
        var accounts = new TreeMap<AccountKey, BigInteger>();
        for (JsonNode entry : pairs(node, "accounts")) {
            var key = entry.get(0);
            if (key == null || !key.isArray() || key.size() != 2) {
                throw new CodecException("Account key must be [party, token]: " + key);
            }
            var accountKey = new AccountKey(LanguageCodec.decodeParty(key.get(0)), LanguageCodec.decodeToken(key.get(1)));
            var amount = integer(entry.get(1));
            if (amount.signum() < 0) {
                throw new CodecException("Negative balance for " + accountKey + ": " + amount);
            }
            accounts.merge(accountKey, amount, BigInteger::add);
        }
        var choices = new TreeMap<ChoiceId, BigInteger>();
        for (JsonNode entry : pairs(node, "choices")) {
            choices.put(LanguageCodec.decodeChoiceId(entry.get(0)), integer(entry.get(1)));
        }
        var bound = new TreeMap<ValueId, BigInteger>();
        for (JsonNode entry : pairs(node, "boundValues")) {
            var id = entry.get(0);
            if (id == null || !id.isTextual()) {
                throw new CodecException("Bound value id must be a string: " + id);
            }
            bound.put(ValueId.of(id.asText()), integer(entry.get(1)));
        }
        return new State(accounts, choices, bound, integer(field(node, "minTime")));
    }

    public static JsonNode encodeState(State state) {
        var node = NODES.objectNode();
        var accounts = node.putArray("accounts");
        state.accounts().forEach((key, amount) -> {
            var pair = accounts.addArray();
            var accountKey = pair.addArray();
            accountKey.add(LanguageCodec.encodeParty(key.owner()));
            accountKey.add(LanguageCodec.encodeToken(key.token()));
            pair.add(amount);
        });
        var choices = node.putArray("choices");
        state.choices().forEach((choiceId, chosen) -> {
            var pair = choices.addArray();
            pair.add(LanguageCodec.encodeChoiceId(choiceId));
            pair.add(chosen);
        });
        var bound = node.putArray("boundValues");
        state.boundValues().forEach((valueId, value) -> {
            var pair = bound.addArray();
            pair.add(valueId.name());
            pair.add(value);
        });
        node.put("minTime", state.minTime());
        return node;
    }

    public static TimeInterval decodeInterval(JsonNode node) {
        requireObject(node, "interval");
        return new TimeInterval(integer(field(node, "from")), integer(field(node, "to")));
    }

    public static JsonNode encodeInterval(TimeInterval interval) {
        var node = NODES.objectNode();
        node.put("from", interval.from());
        node.put("to", interval.to());
        return node;
    }

    public static Transaction decodeTransaction(JsonNode node) {
        requireObject(node, "transaction");
        return new Transaction(decodeInterval(field(node, "tx_interval")), LanguageCodec.decodeInputs(node.get("tx_inputs")));
    }

    public static List<Transaction> decodeTransactions(JsonNode node) {
        if (node == null || !node.isArray()) {
            throw new CodecException("Transactions must be an array: " + node);
        }
        var transactions = new ArrayList<Transaction>();
        for (JsonNode item : node) {
            transactions.add(decodeTransaction(item));
        }
        return transactions;
    }

    public static JsonNode encodePayment(Payment payment) {
        var node = NODES.objectNode();
        node.set("payment_from", LanguageCodec.encodeParty(payment.fromAccount()));
        node.set("to", LanguageCodec.encodePayee(payment.to()));
        node.set("token", LanguageCodec.encodeToken(payment.token()));
        node.put("amount", payment.amount());
        return node;
    }

    public static JsonNode encodeWarning(TransactionWarning warning) {
        if (warning instanceof TransactionWarning.AssertionFailed) {
            return NODES.textNode("assertion_failed");
        }
        var node = NODES.objectNode();
        if (warning instanceof TransactionWarning.NonPositiveDeposit deposit) {
            node.set("party", LanguageCodec.encodeParty(deposit.party()));
            node.put("asDeposit", deposit.amount());
            node.set("of_token", LanguageCodec.encodeToken(deposit.token()));
            node.set("in_account", LanguageCodec.encodeParty(deposit.intoAccount()));
        } else if (warning instanceof TransactionWarning.NonPositivePay pay) {
            node.set("account", LanguageCodec.encodeParty(pay.fromAccount()));
            node.put("asPayment", pay.amount());
            node.set("of_token", LanguageCodec.encodeToken(pay.token()));
            node.set("to_payee", LanguageCodec.encodePayee(pay.to()));
        } else if (warning instanceof TransactionWarning.PartialPay partial) {
            node.set("account", LanguageCodec.encodeParty(partial.fromAccount()));
            node.put("asPayment", partial.expected());
            node.set("of_token", LanguageCodec.encodeToken(partial.token()));
            node.set("to_payee", LanguageCodec.encodePayee(partial.to()));
            node.put("but_only_paid", partial.paid());
        } else if (warning instanceof TransactionWarning.Shadowing shadowing) {
            node.put("value_id", shadowing.valueId().name());
            node.put("had_value", shadowing.hadValue());
            node.put("is_now_assigned", shadowing.reassignedValue());
        }
        return node;
    }

    public static JsonNode encodeReduceResult(ReduceResult result) {
        var node = NODES.objectNode();
        node.put("reduced", result.reduced());
        writeEffects(node, result.warnings(), result.payments());
        node.set("state", encodeState(result.state()));
        node.set("continuation", LanguageCodec.encodeContract(result.continuation()));
        return node;
    }

    public static JsonNode encodeApplyAllResult(ApplyAllResult result) {
        var node = NODES.objectNode();
        node.put("contractChanged", result.contractChanged());
        writeEffects(node, result.warnings(), result.payments());
        node.set("state", encodeState(result.state()));
        node.set("continuation", LanguageCodec.encodeContract(result.continuation()));
        return node;
    }

    public static JsonNode encodeTransactionOutput(TransactionOutput output) {
        var node = NODES.objectNode();
        writeEffects(node, output.warnings(), output.payments());
        node.set("state", encodeState(output.state()));
        node.set("contract", LanguageCodec.encodeContract(output.contract()));
        return node;
    }

    public static JsonNode encodeError(TransactionException error) {
        var node = NODES.objectNode();
        node.put("error", error.code());
        node.put("reason", error.error().name().toLowerCase(Locale.ROOT));
        if (error.getMessage() != null) {
            node.put("message", error.getMessage());
        }
        return node;
    }

    private static void writeEffects(ObjectNode node, List<TransactionWarning> warnings, List<Payment> payments) {
        var warningArray = node.putArray("warnings");
        warnings.forEach(warning -> warningArray.add(encodeWarning(warning)));
        var paymentArray = node.putArray("payments");
        payments.forEach(payment -> paymentArray.add(encodePayment(payment)));
    }

    private static JsonNode pairs(JsonNode node, String name) {
        var value = node.get(name);
        if (value == null || value.isNull()) {
            return NODES.arrayNode();
        }
        if (!value.isArray()) {
            throw new CodecException("Field '" + name + "' must be an array of pairs in " + node);
        }
        for (JsonNode entry : value) {
            if (!entry.isArray() || entry.size() != 2) {
                throw new CodecException("Entry of '" + name + "' must be a pair: " + entry);
            }
        }
        return value;
    }
}
