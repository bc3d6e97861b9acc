package com.ideabridge.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Public view of an {@link AppUser}. Never carries the password hash.
 */
public record UserProfile(
        UUID id,
        String username,
        String mobileNumber,
        String email,
        String name,
        boolean admin,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
