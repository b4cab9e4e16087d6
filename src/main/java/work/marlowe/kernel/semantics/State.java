package work.marlowe.kernel.semantics;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import work.marlowe.kernel.language.ChoiceId;
import work.marlowe.kernel.language.Party;
import work.marlowe.kernel.language.Token;
import work.marlowe.kernel.language.ValueId;

/**
 * Immutable contract state. Accounts only hold positive balances; an account that drops to zero is removed.
 * {@code minTime} never decreases across transactions.
 */
public record State(
    SortedMap<AccountKey, BigInteger> accounts,
    SortedMap<ChoiceId, BigInteger> choices,
    SortedMap<ValueId, BigInteger> boundValues,
    BigInteger minTime
) {
    public State {
        accounts = normalizeAccounts(accounts);
        choices = freeze(choices);
        boundValues = freeze(boundValues);
        Objects.requireNonNull(minTime, "minTime");
    }

    public static State empty(BigInteger minTime) {
        return new State(new TreeMap<>(), new TreeMap<>(), new TreeMap<>(), minTime);
    }

    public static State empty(long minTime) {
        return empty(BigInteger.valueOf(minTime));
    }

    public BigInteger moneyInAccount(Party owner, Token token) {
        return accounts.getOrDefault(new AccountKey(owner, token), BigInteger.ZERO);
    }

    /**
     * Sets the balance of an account; zero or less removes it.
     */
    public State withBalance(Party owner, Token token, BigInteger balance) {
        var updated = new TreeMap<>(accounts);
        var key = new AccountKey(owner, token);
        if (balance.signum() > 0) {
            updated.put(key, balance);
        } else {
            updated.remove(key);
        }
        return new State(updated, choices, boundValues, minTime);
    }

    /**
     * Adds {@code amount} to an account. Non-positive amounts leave the state untouched.
     */
    public State addMoney(Party owner, Token token, BigInteger amount) {
        if (amount.signum() <= 0) {
            return this;
        }
        return withBalance(owner, token, moneyInAccount(owner, token).add(amount));
    }

    public State withoutAccount(AccountKey key) {
        var updated = new TreeMap<>(accounts);
        updated.remove(key);
        return new State(updated, choices, boundValues, minTime);
    }

    public Optional<BigInteger> choice(ChoiceId choiceId) {
        return Optional.ofNullable(choices.get(choiceId));
    }

    public State withChoice(ChoiceId choiceId, BigInteger chosenNum) {
        var updated = new TreeMap<>(choices);
        updated.put(choiceId, chosenNum);
        return new State(accounts, updated, boundValues, minTime);
    }

    public Optional<BigInteger> boundValue(ValueId valueId) {
        return Optional.ofNullable(boundValues.get(valueId));
    }

    public State withBoundValue(ValueId valueId, BigInteger value) {
        var updated = new TreeMap<>(boundValues);
        updated.put(valueId, value);
        return new State(accounts, choices, updated, minTime);
    }

    public State withMinTime(BigInteger newMinTime) {
        return new State(accounts, choices, boundValues, newMinTime);
    }

    public BigInteger totalBalance(Token token) {
        var total = BigInteger.ZERO;
        for (Map.Entry<AccountKey, BigInteger> entry : accounts.entrySet()) {
            if (entry.getKey().token().equals(token)) {
                total = total.add(entry.getValue());
            }
        }
        return total;
    }

    private static SortedMap<AccountKey, BigInteger> normalizeAccounts(Map<AccountKey, BigInteger> source) {
        var copy = new TreeMap<AccountKey, BigInteger>();
        if (source != null) {
            for (var entry : source.entrySet()) {
                var amount = Objects.requireNonNull(entry.getValue(), "balance");
                if (amount.signum() < 0) {
                    throw new IllegalArgumentException("Negative balance for " + entry.getKey() + ": " + amount);
                }
                if (amount.signum() > 0) {
                    copy.put(entry.getKey(), amount);
                }
            }
        }
        return Collections.unmodifiableSortedMap(copy);
    }

    private static <K extends Comparable<K>> SortedMap<K, BigInteger> freeze(Map<K, BigInteger> source) {
        var copy = new TreeMap<K, BigInteger>();
        if (source != null) {
            for (var entry : source.entrySet()) {
                copy.put(entry.getKey(), Objects.requireNonNull(entry.getValue(), "value"));
            }
        }
        return Collections.unmodifiableSortedMap(copy);
    }
}
