package work.marlowe.kernel.runtime;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.marlowe.kernel.codec.CodecException;
import work.marlowe.kernel.codec.LanguageCodec;
import work.marlowe.kernel.codec.MarloweJson;
import work.marlowe.kernel.language.Contract;

/**
 * Loads continuation bundles: JSON or YAML objects mapping a continuation hash to its contract.
 */
public final class BundleLoader {
    private static final Logger LOG = LoggerFactory.getLogger(BundleLoader.class);

    private BundleLoader() {}

    public static Map<String, Contract> load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Bundle not found: " + path);
        }
        var root = MarloweJson.read(path);
        if (!root.isObject()) {
            throw new CodecException("Bundle must be an object of hash -> contract: " + path);
        }
        var entries = new LinkedHashMap<String, Contract>();
        var fields = root.fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            try {
                entries.put(entry.getKey(), LanguageCodec.decodeContract(entry.getValue()));
            } catch (CodecException ex) {
                throw new CodecException("Invalid continuation " + entry.getKey() + " in " + path + ": " + ex.getMessage(), ex);
            }
        }
        LOG.debug("Loaded {} continuation(s) from {}", entries.size(), path);
        return entries;
    }

    public static ContinuationStore loadAll(List<Path> paths) {
        var store = new ContinuationStore();
        for (Path path : paths) {
            store.registerAll(load(path));
        }
        return store;
    }
}
