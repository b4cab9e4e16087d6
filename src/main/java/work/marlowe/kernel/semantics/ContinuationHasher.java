package work.marlowe.kernel.semantics;

import work.marlowe.kernel.language.Contract;

/**
 * Content hash used by the ledger to address merkleized continuations. When one is configured, a disclosed
 * continuation must hash to the hash recorded by the case it targets.
 */
@FunctionalInterface
public interface ContinuationHasher {
    String hash(Contract continuation);
}
