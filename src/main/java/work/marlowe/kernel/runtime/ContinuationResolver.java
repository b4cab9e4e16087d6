package work.marlowe.kernel.runtime;

import java.util.Optional;
import work.marlowe.kernel.language.Contract;

/**
 * Looks up the contract a merkleized case refers to. Called by clients before building a merkleized input; the
 * interpreter itself never resolves anything.
 */
@FunctionalInterface
public interface ContinuationResolver {
    Optional<Contract> resolve(String continuationHash);

    default Contract require(String continuationHash) {
        return resolve(continuationHash).orElseThrow(
            () -> new IllegalStateException("Continuation not found: " + continuationHash)
        );
    }
}
