package work.marlowe.kernel.semantics;

import java.math.BigInteger;
import java.util.Objects;
import work.marlowe.kernel.language.Party;
import work.marlowe.kernel.language.Payee;
import work.marlowe.kernel.language.Token;

/**
 * Money leaving the contract: {@code amount} of {@code token} taken from the account of {@code fromAccount}.
 */
public record Payment(Party fromAccount, Payee to, Token token, BigInteger amount) {
    public Payment {
        Objects.requireNonNull(fromAccount, "fromAccount");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(amount, "amount");
    }
}
