package work.marlowe.kernel.language;

import java.util.Objects;

/**
 * Destination of a {@code Pay}: an internal account of the contract or a party outside it.
 */
public sealed interface Payee permits Payee.Account, Payee.External {

    Party party();

    static Payee account(Party owner) {
        return new Account(owner);
    }

    static Payee party(Party party) {
        return new External(party);
    }

    record Account(Party party) implements Payee {
        public Account {
            Objects.requireNonNull(party, "party");
        }
    }

    record External(Party party) implements Payee {
        public External {
            Objects.requireNonNull(party, "party");
        }
    }
}
