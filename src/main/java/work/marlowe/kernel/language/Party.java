package work.marlowe.kernel.language;

import java.util.Objects;

/**
 * Contract participant, addressed either by a ledger address or by the name of a role token. Addresses order
 * before roles.
 */
public sealed interface Party extends Comparable<Party> permits Party.Address, Party.Role {

    static Party address(String address) {
        return new Address(address);
    }

    static Party role(String roleToken) {
        return new Role(roleToken);
    }

    @Override
    default int compareTo(Party other) {
        if (this instanceof Address a && other instanceof Address b) {
            return a.address().compareTo(b.address());
        }
        if (this instanceof Role a && other instanceof Role b) {
            return a.roleToken().compareTo(b.roleToken());
        }
        return this instanceof Address ? -1 : 1;
    }

    record Address(String address) implements Party {
        public Address {
            Objects.requireNonNull(address, "address");
        }

        @Override
        public String toString() {
            return "address(" + address + ")";
        }
    }

    record Role(String roleToken) implements Party {
        public Role {
            Objects.requireNonNull(roleToken, "roleToken");
        }

        @Override
        public String toString() {
            return "role(" + roleToken + ")";
        }
    }
}
