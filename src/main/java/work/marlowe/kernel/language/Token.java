package work.marlowe.kernel.language;

import java.util.Comparator;
import java.util.Objects;

/**
 * Asset identifier: a currency symbol (minting policy) plus a token name. The native currency is the token with
 * both fields empty.
 */
public record Token(String currencySymbol, String tokenName) implements Comparable<Token> {
    public static final Token ADA = new Token("", "");

    private static final Comparator<Token> ORDER = Comparator
        .comparing(Token::currencySymbol)
        .thenComparing(Token::tokenName);

    public Token {
        Objects.requireNonNull(currencySymbol, "currencySymbol");
        Objects.requireNonNull(tokenName, "tokenName");
    }

    public static Token of(String currencySymbol, String tokenName) {
        return new Token(currencySymbol, tokenName);
    }

    public boolean isAda() {
        return currencySymbol.isEmpty() && tokenName.isEmpty();
    }

    @Override
    public int compareTo(Token other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return isAda() ? "lovelace" : currencySymbol + "." + tokenName;
    }
}
