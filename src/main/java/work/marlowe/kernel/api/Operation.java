package work.marlowe.kernel.api;

/**
 * What a {@link TransactionRunner} run does with the loaded contract.
 */
public enum Operation {
    /** Reduce to quiescence without inputs. */
    REDUCE,
    /** Run one transaction (interval plus inputs) through the transaction boundary checks. */
    APPLY,
    /** List the actions that can be taken now. */
    NEXT
}
