package com.ideabridge.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

public record AuthSession(
        UUID id,
        UUID userId,
        String token,
        OffsetDateTime expiresAt,
        OffsetDateTime createdAt,
        UserProfile user
) {

    public static AuthSession of(UserSession session) {
        UserProfile profile = session.getUser().toProfile();
        return new AuthSession(
                session.getId(),
                profile.id(),
                session.getToken(),
                session.getExpiresAt(),
                session.getCreatedAt(),
                profile
        );
    }

    @Override
    public String toString() {
        return "AuthSession[id=" + id + ", userId=" + userId + ", token=[REDACTED], expiresAt=" + expiresAt + "]";
    }
}
