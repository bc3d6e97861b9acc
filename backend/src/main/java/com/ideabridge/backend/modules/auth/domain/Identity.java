package com.ideabridge.backend.modules.auth.domain;

import java.util.Objects;

/**
 * The proof method an account was registered with. An account holds exactly one of the two
 * variants; {@link AppUser} stores it as nullable columns but can only be built from this type.
 */
public sealed interface Identity permits Identity.Credentials, Identity.Mobile {

    record Credentials(String username, String passwordHash) implements Identity {

        public Credentials {
            Objects.requireNonNull(username, "username is required");
            Objects.requireNonNull(passwordHash, "passwordHash is required");
        }

        @Override
        public String toString() {
            return "Credentials[username=" + username + ", passwordHash=[REDACTED]]";
        }
    }

    record Mobile(String mobileNumber) implements Identity {

        public Mobile {
            Objects.requireNonNull(mobileNumber, "mobileNumber is required");
        }
    }
}
