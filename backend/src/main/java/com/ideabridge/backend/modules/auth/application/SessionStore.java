package com.ideabridge.backend.modules.auth.application;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.ideabridge.backend.modules.auth.domain.AppUser;
import com.ideabridge.backend.modules.auth.domain.AuthSession;
import com.ideabridge.backend.modules.auth.domain.UserSession;
import com.ideabridge.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.ideabridge.backend.modules.auth.infrastructure.persistence.UserSessionRepository;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Opaque bearer-token sessions. Nothing is cached: every lookup reads the current row.
 */
@Service
public class SessionStore {

    private static final int TOKEN_BYTES = 32;

    private final UserSessionRepository userSessionRepository;
    private final AppUserRepository appUserRepository;
    private final Clock clock;
    private final int defaultTtlDays;
    private final SecureRandom secureRandom = new SecureRandom();
    private final Base64.Encoder tokenEncoder = Base64.getUrlEncoder().withoutPadding();

    public SessionStore(
            UserSessionRepository userSessionRepository,
            AppUserRepository appUserRepository,
            Clock clock,
            @Value("${auth.session.expiry-days:7}") int defaultTtlDays
    ) {
        this.userSessionRepository = userSessionRepository;
        this.appUserRepository = appUserRepository;
        this.clock = clock;
        this.defaultTtlDays = defaultTtlDays;
    }

    public String generateToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return tokenEncoder.encodeToString(bytes);
    }

    @Transactional
    public AuthSession create(UUID userId) {
        return create(userId, defaultTtlDays);
    }

    @Transactional
    public AuthSession create(UUID userId, int ttlDays) {
        Objects.requireNonNull(userId, "userId is required");
        if (ttlDays <= 0) {
            throw new IllegalArgumentException("ttlDays must be positive");
        }
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> new IllegalStateException("Cannot open a session for unknown user " + userId));

        OffsetDateTime now = OffsetDateTime.now(clock);
        UserSession session = new UserSession();
        session.setUser(user);
        session.setToken(generateToken());
        session.setCreatedAt(now);
        session.setExpiresAt(now.plusDays(ttlDays));
        return AuthSession.of(userSessionRepository.save(session));
    }

    /**
     * Resolves a token to its live session.
     * <p>
     * Not a pure read: an expired session found here is deleted before returning empty. A concurrent
     * caller may already have removed it, which is not an error.
     */
    @Transactional
    public Optional<AuthSession> validate(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        Optional<UserSession> found = userSessionRepository.findByTokenWithUser(token);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        UserSession session = found.get();
        if (session.isExpiredAt(OffsetDateTime.now(clock))) {
            userSessionRepository.deleteSessionById(session.getId());
            return Optional.empty();
        }
        return Optional.of(AuthSession.of(session));
    }

    /**
     * @return whether a session row was deleted
     */
    @Transactional
    public boolean invalidate(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        return userSessionRepository.deleteByToken(token) > 0;
    }

    @Transactional
    public int invalidateAllForUser(UUID userId) {
        return userSessionRepository.deleteAllByUserId(userId);
    }

    @Transactional
    public int sweepExpired() {
        return userSessionRepository.deleteExpired(OffsetDateTime.now(clock));
    }
}
