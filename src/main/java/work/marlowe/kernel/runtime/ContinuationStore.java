package work.marlowe.kernel.runtime;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import work.marlowe.kernel.language.Contract;

/**
 * In-memory continuation store keyed by continuation hash.
 */
public final class ContinuationStore implements ContinuationResolver {
    private final Map<String, Contract> continuations = new ConcurrentHashMap<>();

    public ContinuationStore register(String continuationHash, Contract continuation) {
        Objects.requireNonNull(continuationHash, "continuationHash");
        Objects.requireNonNull(continuation, "continuation");
        continuations.put(continuationHash, continuation);
        return this;
    }

    public ContinuationStore registerAll(Map<String, Contract> entries) {
        if (entries != null) {
            entries.forEach(this::register);
        }
        return this;
    }

    @Override
    public Optional<Contract> resolve(String continuationHash) {
        if (continuationHash == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(continuations.get(continuationHash));
    }

    public void unregister(String continuationHash) {
        if (continuationHash != null) {
            continuations.remove(continuationHash);
        }
    }

    public int size() {
        return continuations.size();
    }

    public Map<String, Contract> entries() {
        return Collections.unmodifiableMap(continuations);
    }
}
