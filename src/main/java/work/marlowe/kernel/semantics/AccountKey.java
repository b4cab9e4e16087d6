package work.marlowe.kernel.semantics;

import java.util.Comparator;
import java.util.Objects;
import work.marlowe.kernel.language.Party;
import work.marlowe.kernel.language.Token;

/**
 * Key of an internal account: the owning party and the token held.
 */
public record AccountKey(Party owner, Token token) implements Comparable<AccountKey> {
    private static final Comparator<AccountKey> ORDER = Comparator
        .comparing(AccountKey::owner)
        .thenComparing(AccountKey::token);

    public AccountKey {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(token, "token");
    }

    @Override
    public int compareTo(AccountKey other) {
        return ORDER.compare(this, other);
    }
}
