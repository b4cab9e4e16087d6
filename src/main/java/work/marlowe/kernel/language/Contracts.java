package work.marlowe.kernel.language;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Static queries over contract trees.
 */
public final class Contracts {
    private Contracts() {}

    /**
     * Earliest {@code When} timeout strictly after {@code minTime} reachable without taking any case. Both branches of
     * an {@code If} are considered; a {@code When} that already timed out is looked through.
     */
    public static Optional<BigInteger> nextTimeout(Contract contract, BigInteger minTime) {
        BigInteger earliest = null;
        Deque<Contract> pending = new ArrayDeque<>();
        pending.push(contract);
        while (!pending.isEmpty()) {
            var current = pending.pop();
            if (current instanceof Contract.Close) {
                continue;
            }
            if (current instanceof Contract.Pay pay) {
                pending.push(pay.then());
            } else if (current instanceof Contract.If branch) {
                pending.push(branch.then());
                pending.push(branch.otherwise());
            } else if (current instanceof Contract.When when) {
                if (when.timeout().compareTo(minTime) > 0) {
                    earliest = earliest == null ? when.timeout() : earliest.min(when.timeout());
                } else {
                    pending.push(when.timeoutContinuation());
                }
            } else if (current instanceof Contract.Let let) {
                pending.push(let.then());
            } else if (current instanceof Contract.Assert assertion) {
                pending.push(assertion.then());
            } else {
                throw new IllegalStateException("Unknown contract: " + current);
            }
        }
        return Optional.ofNullable(earliest);
    }

    /**
     * Number of contract nodes in the tree, inline case continuations included. Merkleized continuations are not
     * followed.
     */
    public static long size(Contract contract) {
        long count = 0;
        Deque<Contract> pending = new ArrayDeque<>();
        pending.push(contract);
        while (!pending.isEmpty()) {
            var current = pending.pop();
            count++;
            if (current instanceof Contract.Pay pay) {
                pending.push(pay.then());
            } else if (current instanceof Contract.If branch) {
                pending.push(branch.then());
                pending.push(branch.otherwise());
            } else if (current instanceof Contract.When when) {
                for (Case c : when.cases()) {
                    if (c instanceof Case.Inline inline) {
                        pending.push(inline.then());
                    }
                }
                pending.push(when.timeoutContinuation());
            } else if (current instanceof Contract.Let let) {
                pending.push(let.then());
            } else if (current instanceof Contract.Assert assertion) {
                pending.push(assertion.then());
            }
        }
        return count;
    }
}
