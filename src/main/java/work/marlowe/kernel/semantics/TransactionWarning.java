package work.marlowe.kernel.semantics;

import java.math.BigInteger;
import work.marlowe.kernel.language.Party;
import work.marlowe.kernel.language.Payee;
import work.marlowe.kernel.language.Token;
import work.marlowe.kernel.language.ValueId;

/**
 * Non-fatal deviation observed while running a transaction: the transaction succeeded, but not exactly as written.
 */
public sealed interface TransactionWarning
    permits TransactionWarning.NonPositiveDeposit, TransactionWarning.NonPositivePay, TransactionWarning.PartialPay,
    TransactionWarning.Shadowing, TransactionWarning.AssertionFailed {

    TransactionWarning ASSERTION_FAILED = new AssertionFailed();

    /** A deposit input of zero or less matched; nothing was credited. */
    record NonPositiveDeposit(Party party, Party intoAccount, Token token, BigInteger amount)
        implements TransactionWarning {}

    /** A {@code Pay} evaluated to zero or less; nothing moved. */
    record NonPositivePay(Party fromAccount, Payee to, Token token, BigInteger amount) implements TransactionWarning {}

    /** The source account could not cover the whole {@code Pay}; only {@code paid} moved. */
    record PartialPay(Party fromAccount, Payee to, Token token, BigInteger paid, BigInteger expected)
        implements TransactionWarning {}

    record Shadowing(ValueId valueId, BigInteger hadValue, BigInteger reassignedValue) implements TransactionWarning {}

    record AssertionFailed() implements TransactionWarning {}
}
