package work.marlowe.kernel.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.marlowe.kernel.advisor.ApplicableAction;
import work.marlowe.kernel.advisor.ApplicableActions;
import work.marlowe.kernel.codec.LanguageCodec;
import work.marlowe.kernel.codec.MarloweJson;
import work.marlowe.kernel.codec.SemanticsCodec;
import work.marlowe.kernel.language.Contract;
import work.marlowe.kernel.runtime.BundleLoader;
import work.marlowe.kernel.semantics.Environment;
import work.marlowe.kernel.semantics.Semantics;
import work.marlowe.kernel.semantics.State;
import work.marlowe.kernel.semantics.TimeInterval;
import work.marlowe.kernel.semantics.Transaction;
import work.marlowe.kernel.semantics.TransactionException;

/**
 * Public entry point for running the interpreter on contract files.
 */
public final class TransactionRunner {
    private static final Logger LOG = LoggerFactory.getLogger(TransactionRunner.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public RunResult run(RunConfiguration configuration) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("operation", configuration.operation().name().toLowerCase(Locale.ROOT));
        metadata.put("contract", configuration.contractPath().toString());
        try {
            var semantics = Semantics.builder().maxSteps(configuration.maxSteps()).build();
            var contract = LanguageCodec.decodeContract(MarloweJson.read(configuration.contractPath()));
            switch (configuration.operation()) {
                case REDUCE -> reduce(semantics, configuration, contract, metadata);
                case APPLY -> apply(semantics, configuration, contract, metadata);
                case NEXT -> next(semantics, configuration, contract, metadata);
                default -> throw new IllegalStateException("Unknown operation: " + configuration.operation());
            }
            metadata.put("status", "ok");
            return RunResult.success(metadata, started);
        } catch (TransactionException ex) {
            LOG.info("Transaction rejected: {} ({})", ex.code(), ex.getMessage());
            metadata.put("error", ex.code());
            metadata.put("reason", SemanticsCodec.encodeError(ex));
            return RunResult.failure(ex.code(), metadata, started);
        } catch (Exception ex) {
            if (ex.getMessage() != null && !ex.getMessage().isBlank()) {
                metadata.put("error", ex.getMessage());
            }
            if (Boolean.getBoolean("marlowe.debug")) {
                ex.printStackTrace();
            }
            return RunResult.failure(ex.getClass().getSimpleName(), metadata, started);
        }
    }

    private void reduce(Semantics semantics, RunConfiguration configuration, Contract contract, Map<String, Object> out) {
        var interval = requireInterval(configuration);
        var state = loadState(configuration, interval.from());
        var result = semantics.reduceContractUntilQuiescent(new Environment(interval), state, contract);
        out.put("result", SemanticsCodec.encodeReduceResult(result));
    }

    private void apply(Semantics semantics, RunConfiguration configuration, Contract contract, Map<String, Object> out) {
        var interval = requireInterval(configuration);
        var state = loadState(configuration, interval.from());
        var inputs = LanguageCodec.decodeInputs(MarloweJson.parse(configuration.inputPayload()));
        var output = semantics.computeTransaction(new Transaction(interval, inputs), state, contract);
        LOG.info("Transaction accepted with {} payment(s)", output.payments().size());
        out.put("result", SemanticsCodec.encodeTransactionOutput(output));
    }

    private void next(Semantics semantics, RunConfiguration configuration, Contract contract, Map<String, Object> out) {
        var now = configuration.now()
            .or(() -> configuration.interval().map(TimeInterval::from))
            .orElseGet(() -> BigInteger.valueOf(Instant.now().toEpochMilli()));
        var state = loadState(configuration, now);
        var env = configuration.interval()
            .map(Environment::new)
            .orElseGet(() -> ApplicableActions.defaultEnvironment(contract, now, configuration.window()));
        var store = BundleLoader.loadAll(configuration.bundles());
        var actions = new ApplicableActions(semantics, store).compute(env, state, contract);
        out.put("environment", SemanticsCodec.encodeInterval(env.timeInterval()));
        out.put("actions", describe(actions));
    }

    private static TimeInterval requireInterval(RunConfiguration configuration) {
        return configuration.interval().orElseThrow(
            () -> new IllegalArgumentException("A time interval is required for " + configuration.operation())
        );
    }

    private static State loadState(RunConfiguration configuration, BigInteger defaultMinTime) {
        return configuration.statePath()
            .map(path -> SemanticsCodec.decodeState(MarloweJson.read(path)))
            .orElseGet(() -> Semantics.emptyState(defaultMinTime));
    }

    private static JsonNode describe(List<ApplicableAction> actions) {
        ArrayNode array = NODES.arrayNode();
        for (ApplicableAction action : actions) {
            ObjectNode node = array.addObject();
            if (action instanceof ApplicableAction.AdvanceTimeout) {
                node.put("type", "advance_timeout");
            } else if (action instanceof ApplicableAction.CanDeposit deposit) {
                node.put("type", "deposit");
                node.set("action", LanguageCodec.encodeAction(deposit.deposit()));
                node.put("amount", deposit.amount());
            } else if (action instanceof ApplicableAction.CanChoose choose) {
                node.put("type", "choice");
                node.set("action", LanguageCodec.encodeAction(choose.choice()));
            } else if (action instanceof ApplicableAction.CanNotify notify) {
                node.put("type", "notify");
                node.set("action", LanguageCodec.encodeAction(notify.notification()));
            }
            action.applicant().ifPresent(party -> node.set("applicant", LanguageCodec.encodeParty(party)));
        }
        return array;
    }
}
