package work.marlowe.kernel.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import work.marlowe.kernel.language.Action;
import work.marlowe.kernel.language.Bound;
import work.marlowe.kernel.language.Case;
import work.marlowe.kernel.language.ChoiceId;
import work.marlowe.kernel.language.Contract;
import work.marlowe.kernel.language.Input;
import work.marlowe.kernel.language.InputContent;
import work.marlowe.kernel.language.Observation;
import work.marlowe.kernel.language.Party;
import work.marlowe.kernel.language.Payee;
import work.marlowe.kernel.language.Token;
import work.marlowe.kernel.language.Value;
import work.marlowe.kernel.language.ValueId;

/**
 * JSON form of the contract language (contracts, values, observations, inputs), field names as used on the wire.
 */
public final class LanguageCodec {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private LanguageCodec() {}

    // ---- decoding ----

    public static Token decodeToken(JsonNode node) {
        requireObject(node, "token");
        return new Token(text(node, "currency_symbol"), text(node, "token_name"));
    }

    public static Party decodeParty(JsonNode node) {
        requireObject(node, "party");
        if (node.has("address")) {
            return Party.address(text(node, "address"));
        }
        if (node.has("role_token")) {
            return Party.role(text(node, "role_token"));
        }
        throw new CodecException("Party must have 'address' or 'role_token': " + node);
    }

    public static ChoiceId decodeChoiceId(JsonNode node) {
        requireObject(node, "choice id");
        return new ChoiceId(text(node, "choice_name"), decodeParty(field(node, "choice_owner")));
    }

    public static Bound decodeBound(JsonNode node) {
        requireObject(node, "bound");
        return new Bound(integer(field(node, "from")), integer(field(node, "to")));
    }

    public static Payee decodePayee(JsonNode node) {
        requireObject(node, "payee");
        if (node.has("account")) {
            return Payee.account(decodeParty(node.get("account")));
        }
        if (node.has("party")) {
            return Payee.party(decodeParty(node.get("party")));
        }
        throw new CodecException("Payee must have 'account' or 'party': " + node);
    }

    public static Value decodeValue(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new CodecException("Missing value");
        }
        if (node.isIntegralNumber()) {
            return new Value.Constant(node.bigIntegerValue());
        }
        if (node.isTextual()) {
            switch (node.asText()) {
                case "time_interval_start":
                    return new Value.TimeIntervalStart();
                case "time_interval_end":
                    return new Value.TimeIntervalEnd();
                default:
                    throw new CodecException("Unknown value: " + node);
            }
        }
        requireObject(node, "value");
        if (node.has("amount_of_token")) {
            return new Value.AvailableMoney(decodeParty(field(node, "in_account")), decodeToken(node.get("amount_of_token")));
        }
        if (node.has("negate")) {
            return new Value.Negate(decodeValue(node.get("negate")));
        }
        if (node.has("add")) {
            return new Value.Add(decodeValue(node.get("add")), decodeValue(field(node, "and")));
        }
        if (node.has("minus")) {
            return new Value.Sub(decodeValue(field(node, "value")), decodeValue(node.get("minus")));
        }
        if (node.has("multiply")) {
            return new Value.Mul(decodeValue(node.get("multiply")), decodeValue(field(node, "times")));
        }
        if (node.has("divide")) {
            return new Value.Div(decodeValue(node.get("divide")), decodeValue(field(node, "by")));
        }
        if (node.has("value_of_choice")) {
            return new Value.ChoiceValue(decodeChoiceId(node.get("value_of_choice")));
        }
        if (node.has("use_value")) {
            return new Value.UseValue(ValueId.of(text(node, "use_value")));
        }
        if (node.has("if")) {
            return new Value.Cond(
                decodeObservation(node.get("if")),
                decodeValue(field(node, "then")),
                decodeValue(field(node, "else"))
            );
        }
        throw new CodecException("Unknown value: " + node);
    }

    public static Observation decodeObservation(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new CodecException("Missing observation");
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? Observation.TRUE : Observation.FALSE;
        }
        requireObject(node, "observation");
        if (node.has("both")) {
            return new Observation.And(decodeObservation(node.get("both")), decodeObservation(field(node, "and")));
        }
        if (node.has("either")) {
            return new Observation.Or(decodeObservation(node.get("either")), decodeObservation(field(node, "or")));
        }
        if (node.has("not")) {
            return new Observation.Not(decodeObservation(node.get("not")));
        }
        if (node.has("chose_something_for")) {
            return new Observation.ChoseSomething(decodeChoiceId(node.get("chose_something_for")));
        }
        if (node.has("ge_than")) {
            return new Observation.ValueGE(decodeValue(field(node, "value")), decodeValue(node.get("ge_than")));
        }
        if (node.has("gt")) {
            return new Observation.ValueGT(decodeValue(field(node, "value")), decodeValue(node.get("gt")));
        }
        if (node.has("lt")) {
            return new Observation.ValueLT(decodeValue(field(node, "value")), decodeValue(node.get("lt")));
        }
        if (node.has("le_than")) {
            return new Observation.ValueLE(decodeValue(field(node, "value")), decodeValue(node.get("le_than")));
        }
        if (node.has("equal_to")) {
            return new Observation.ValueEQ(decodeValue(field(node, "value")), decodeValue(node.get("equal_to")));
        }
        throw new CodecException("Unknown observation: " + node);
    }

    public static Action decodeAction(JsonNode node) {
        requireObject(node, "action");
        if (node.has("deposits")) {
            return new Action.Deposit(
                decodeParty(field(node, "into_account")),
                decodeParty(field(node, "party")),
                decodeToken(field(node, "of_token")),
                decodeValue(node.get("deposits"))
            );
        }
        if (node.has("choose_between")) {
            var bounds = new ArrayList<Bound>();
            for (JsonNode bound : array(node, "choose_between")) {
                bounds.add(decodeBound(bound));
            }
            return new Action.Choice(decodeChoiceId(field(node, "for_choice")), bounds);
        }
        if (node.has("notify_if")) {
            return new Action.Notify(decodeObservation(node.get("notify_if")));
        }
        throw new CodecException("Unknown action: " + node);
    }

    public static Case decodeCase(JsonNode node) {
        requireObject(node, "case");
        var action = decodeAction(field(node, "case"));
        if (node.has("merkleized_then")) {
            return Case.merkleized(action, text(node, "merkleized_then"));
        }
        return Case.of(action, decodeContract(field(node, "then")));
    }

    public static Contract decodeContract(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new CodecException("Missing contract");
        }
        if (node.isTextual()) {
            if ("close".equals(node.asText())) {
                return Contract.CLOSE;
            }
            throw new CodecException("Unknown contract: " + node);
        }
        requireObject(node, "contract");
        if (node.has("pay")) {
            return new Contract.Pay(
                decodeParty(field(node, "from_account")),
                decodePayee(field(node, "to")),
                decodeToken(field(node, "token")),
                decodeValue(node.get("pay")),
                decodeContract(field(node, "then"))
            );
        }
        if (node.has("when")) {
            var cases = new ArrayList<Case>();
            for (JsonNode item : array(node, "when")) {
                cases.add(decodeCase(item));
            }
            return new Contract.When(
                cases,
                integer(field(node, "timeout")),
                decodeContract(field(node, "timeout_continuation"))
            );
        }
        if (node.has("if")) {
            return new Contract.If(
                decodeObservation(node.get("if")),
                decodeContract(field(node, "then")),
                decodeContract(field(node, "else"))
            );
        }
        if (node.has("let")) {
            return new Contract.Let(
                ValueId.of(text(node, "let")),
                decodeValue(field(node, "be")),
                decodeContract(field(node, "then"))
            );
        }
        if (node.has("assert")) {
            return new Contract.Assert(decodeObservation(node.get("assert")), decodeContract(field(node, "then")));
        }
        throw new CodecException("Unknown contract: " + node);
    }

    public static Input decodeInput(JsonNode node) {
        if (node != null && node.isTextual() && "input_notify".equals(node.asText())) {
            return Input.notifyInput();
        }
        requireObject(node, "input");
        InputContent content;
        if (node.has("input_from_party")) {
            content = new InputContent.IDeposit(
                decodeParty(field(node, "into_account")),
                decodeParty(node.get("input_from_party")),
                decodeToken(field(node, "of_token")),
                integer(field(node, "that_deposits"))
            );
        } else if (node.has("for_choice_id")) {
            content = new InputContent.IChoice(
                decodeChoiceId(node.get("for_choice_id")),
                integer(field(node, "input_that_chooses_num"))
            );
        } else if (node.has("continuation_hash")) {
            content = InputContent.NOTIFY;
        } else {
            throw new CodecException("Unknown input: " + node);
        }
        if (node.has("continuation_hash")) {
            return new Input.Merkleized(
                content,
                text(node, "continuation_hash"),
                decodeContract(field(node, "merkleized_continuation"))
            );
        }
        return new Input.Normal(content);
    }

    public static List<Input> decodeInputs(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new CodecException("Inputs must be an array: " + node);
        }
        var inputs = new ArrayList<Input>();
        for (JsonNode item : node) {
            inputs.add(decodeInput(item));
        }
        return inputs;
    }

    // ---- encoding ----

    public static JsonNode encodeToken(Token token) {
        var node = NODES.objectNode();
        node.put("currency_symbol", token.currencySymbol());
        node.put("token_name", token.tokenName());
        return node;
    }

    public static JsonNode encodeParty(Party party) {
        var node = NODES.objectNode();
        if (party instanceof Party.Address address) {
            node.put("address", address.address());
        } else if (party instanceof Party.Role role) {
            node.put("role_token", role.roleToken());
        }
        return node;
    }

    public static JsonNode encodeChoiceId(ChoiceId choiceId) {
        var node = NODES.objectNode();
        node.put("choice_name", choiceId.choiceName());
        node.set("choice_owner", encodeParty(choiceId.choiceOwner()));
        return node;
    }

    public static JsonNode encodeBound(Bound bound) {
        var node = NODES.objectNode();
        node.put("from", bound.from());
        node.put("to", bound.to());
        return node;
    }

    public static JsonNode encodePayee(Payee payee) {
        var node = NODES.objectNode();
        node.set(payee instanceof Payee.Account ? "account" : "party", encodeParty(payee.party()));
        return node;
    }

    public static JsonNode encodeValue(Value value) {
        if (value instanceof Value.Constant constant) {
            return NODES.numberNode(constant.value());
        }
        if (value instanceof Value.TimeIntervalStart) {
            return NODES.textNode("time_interval_start");
        }
        if (value instanceof Value.TimeIntervalEnd) {
            return NODES.textNode("time_interval_end");
        }
        var node = NODES.objectNode();
        if (value instanceof Value.AvailableMoney money) {
            node.set("amount_of_token", encodeToken(money.token()));
            node.set("in_account", encodeParty(money.account()));
        } else if (value instanceof Value.Negate negate) {
            node.set("negate", encodeValue(negate.value()));
        } else if (value instanceof Value.Add add) {
            node.set("add", encodeValue(add.left()));
            node.set("and", encodeValue(add.right()));
        } else if (value instanceof Value.Sub sub) {
            node.set("value", encodeValue(sub.left()));
            node.set("minus", encodeValue(sub.right()));
        } else if (value instanceof Value.Mul mul) {
            node.set("multiply", encodeValue(mul.left()));
            node.set("times", encodeValue(mul.right()));
        } else if (value instanceof Value.Div div) {
            node.set("divide", encodeValue(div.dividend()));
            node.set("by", encodeValue(div.divisor()));
        } else if (value instanceof Value.ChoiceValue choice) {
            node.set("value_of_choice", encodeChoiceId(choice.choiceId()));
        } else if (value instanceof Value.UseValue use) {
            node.put("use_value", use.valueId().name());
        } else if (value instanceof Value.Cond cond) {
            node.set("if", encodeObservation(cond.condition()));
            node.set("then", encodeValue(cond.then()));
            node.set("else", encodeValue(cond.otherwise()));
        }
        return node;
    }

    public static JsonNode encodeObservation(Observation observation) {
        if (observation instanceof Observation.True) {
            return NODES.booleanNode(true);
        }
        if (observation instanceof Observation.False) {
            return NODES.booleanNode(false);
        }
        var node = NODES.objectNode();
        if (observation instanceof Observation.And and) {
            node.set("both", encodeObservation(and.left()));
            node.set("and", encodeObservation(and.right()));
        } else if (observation instanceof Observation.Or or) {
            node.set("either", encodeObservation(or.left()));
            node.set("or", encodeObservation(or.right()));
        } else if (observation instanceof Observation.Not not) {
            node.set("not", encodeObservation(not.observation()));
        } else if (observation instanceof Observation.ChoseSomething chose) {
            node.set("chose_something_for", encodeChoiceId(chose.choiceId()));
        } else if (observation instanceof Observation.ValueGE ge) {
            comparison(node, ge.left(), "ge_than", ge.right());
        } else if (observation instanceof Observation.ValueGT gt) {
            comparison(node, gt.left(), "gt", gt.right());
        } else if (observation instanceof Observation.ValueLT lt) {
            comparison(node, lt.left(), "lt", lt.right());
        } else if (observation instanceof Observation.ValueLE le) {
            comparison(node, le.left(), "le_than", le.right());
        } else if (observation instanceof Observation.ValueEQ eq) {
            comparison(node, eq.left(), "equal_to", eq.right());
        }
        return node;
    }

    public static JsonNode encodeAction(Action action) {
        var node = NODES.objectNode();
        if (action instanceof Action.Deposit deposit) {
            node.set("party", encodeParty(deposit.party()));
            node.set("deposits", encodeValue(deposit.amount()));
            node.set("of_token", encodeToken(deposit.token()));
            node.set("into_account", encodeParty(deposit.intoAccount()));
        } else if (action instanceof Action.Choice choice) {
            node.set("for_choice", encodeChoiceId(choice.choiceId()));
            var bounds = node.putArray("choose_between");
            choice.bounds().forEach(bound -> bounds.add(encodeBound(bound)));
        } else if (action instanceof Action.Notify notify) {
            node.set("notify_if", encodeObservation(notify.observation()));
        }
        return node;
    }

    public static JsonNode encodeCase(Case branch) {
        var node = NODES.objectNode();
        node.set("case", encodeAction(branch.action()));
        if (branch instanceof Case.Inline inline) {
            node.set("then", encodeContract(inline.then()));
        } else if (branch instanceof Case.Merkleized merkleized) {
            node.put("merkleized_then", merkleized.continuationHash());
        }
        return node;
    }

    public static JsonNode encodeContract(Contract contract) {
        if (contract instanceof Contract.Close) {
            return NODES.textNode("close");
        }
        var node = NODES.objectNode();
        if (contract instanceof Contract.Pay pay) {
            node.set("pay", encodeValue(pay.amount()));
            node.set("token", encodeToken(pay.token()));
            node.set("from_account", encodeParty(pay.fromAccount()));
            node.set("to", encodePayee(pay.payee()));
            node.set("then", encodeContract(pay.then()));
        } else if (contract instanceof Contract.If branch) {
            node.set("if", encodeObservation(branch.condition()));
            node.set("then", encodeContract(branch.then()));
            node.set("else", encodeContract(branch.otherwise()));
        } else if (contract instanceof Contract.When when) {
            ArrayNode cases = node.putArray("when");
            when.cases().forEach(c -> cases.add(encodeCase(c)));
            node.put("timeout", when.timeout());
            node.set("timeout_continuation", encodeContract(when.timeoutContinuation()));
        } else if (contract instanceof Contract.Let let) {
            node.put("let", let.valueId().name());
            node.set("be", encodeValue(let.value()));
            node.set("then", encodeContract(let.then()));
        } else if (contract instanceof Contract.Assert assertion) {
            node.set("assert", encodeObservation(assertion.observation()));
            node.set("then", encodeContract(assertion.then()));
        }
        return node;
    }

    public static JsonNode encodeInput(Input input) {
        var content = input.content();
        if (input instanceof Input.Normal && content instanceof InputContent.INotify) {
            return NODES.textNode("input_notify");
        }
        var node = NODES.objectNode();
        if (content instanceof InputContent.IDeposit deposit) {
            node.set("input_from_party", encodeParty(deposit.party()));
            node.put("that_deposits", deposit.quantity());
            node.set("of_token", encodeToken(deposit.token()));
            node.set("into_account", encodeParty(deposit.intoAccount()));
        } else if (content instanceof InputContent.IChoice choice) {
            node.set("for_choice_id", encodeChoiceId(choice.choiceId()));
            node.put("input_that_chooses_num", choice.chosenNum());
        }
        if (input instanceof Input.Merkleized merkleized) {
            node.put("continuation_hash", merkleized.continuationHash());
            node.set("merkleized_continuation", encodeContract(merkleized.continuation()));
        }
        return node;
    }

    public static JsonNode encodeInputs(List<Input> inputs) {
        var array = NODES.arrayNode();
        inputs.forEach(input -> array.add(encodeInput(input)));
        return array;
    }

    // ---- helpers shared with SemanticsCodec ----

    static void requireObject(JsonNode node, String what) {
        if (node == null || !node.isObject()) {
            throw new CodecException("Expected " + what + " object, got: " + node);
        }
    }

    static JsonNode field(JsonNode node, String name) {
        var value = node.get(name);
        if (value == null || value.isNull()) {
            throw new CodecException("Missing field '" + name + "' in " + node);
        }
        return value;
    }

    static String text(JsonNode node, String name) {
        var value = field(node, name);
        if (!value.isTextual()) {
            throw new CodecException("Field '" + name + "' must be a string in " + node);
        }
        return value.asText();
    }

    static BigInteger integer(JsonNode node) {
        if (node == null || !node.isIntegralNumber()) {
            throw new CodecException("Expected integer, got: " + node);
        }
        return node.bigIntegerValue();
    }

    static JsonNode array(JsonNode node, String name) {
        var value = field(node, name);
        if (!value.isArray()) {
            throw new CodecException("Field '" + name + "' must be an array in " + node);
        }
        return value;
    }

    private static void comparison(ObjectNode node, Value left, String operator, Value right) {
        node.set("value", encodeValue(left));
        node.set(operator, encodeValue(right));
    }
}
