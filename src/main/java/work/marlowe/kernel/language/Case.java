package work.marlowe.kernel.language;

import java.util.Objects;

/**
 * Branch of a {@code When}: an action and the contract to continue with once it happens. The continuation is
 * either inline or referenced by its content hash.
 */
public sealed interface Case permits Case.Inline, Case.Merkleized {

    Action action();

    static Case of(Action action, Contract then) {
        return new Inline(action, then);
    }

    static Case merkleized(Action action, String continuationHash) {
        return new Merkleized(action, continuationHash);
    }

    record Inline(Action action, Contract then) implements Case {
        public Inline {
            Objects.requireNonNull(action, "action");
            Objects.requireNonNull(then, "then");
        }
    }

    record Merkleized(Action action, String continuationHash) implements Case {
        public Merkleized {
            Objects.requireNonNull(action, "action");
            Objects.requireNonNull(continuationHash, "continuationHash");
        }
    }
}
