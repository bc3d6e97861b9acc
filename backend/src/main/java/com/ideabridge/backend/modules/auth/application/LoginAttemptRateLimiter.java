package com.ideabridge.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.ideabridge.backend.modules.auth.domain.LoginAttempt;
import com.ideabridge.backend.modules.auth.infrastructure.persistence.LoginAttemptRepository;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Sliding-window limiter backed by the {@code login_attempt} table. An identifier is blocked once it
 * has {@code auth.rate-limit.attempts} failures within the last {@code auth.rate-limit.window-minutes}.
 */
@Service
public class LoginAttemptRateLimiter implements LoginRateLimiter {

    private final LoginAttemptRepository loginAttemptRepository;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration window;

    public LoginAttemptRateLimiter(
            LoginAttemptRepository loginAttemptRepository,
            Clock clock,
            @Value("${auth.rate-limit.attempts:5}") int maxAttempts,
            @Value("${auth.rate-limit.window-minutes:15}") int windowMinutes
    ) {
        this.loginAttemptRepository = loginAttemptRepository;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        this.window = Duration.ofMinutes(windowMinutes);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isRateLimited(String identifier) {
        return loginAttemptRepository.countFailuresSince(identifier, windowStart(now())) >= maxAttempts;
    }

    @Override
    @Transactional
    public void recordAttempt(String identifier, boolean success, UUID userId) {
        LoginAttempt attempt = new LoginAttempt();
        attempt.setIdentifier(identifier);
        attempt.setSuccess(success);
        attempt.setUserId(userId);
        attempt.setAttemptAt(now());
        loginAttemptRepository.save(attempt);
    }

    @Override
    @Transactional(readOnly = true)
    public Duration retryAfter(String identifier) {
        OffsetDateTime now = now();
        if (loginAttemptRepository.countFailuresSince(identifier, windowStart(now)) < maxAttempts) {
            return Duration.ZERO;
        }
        return loginAttemptRepository
                .findFirstByIdentifierAndSuccessFalseAndAttemptAtGreaterThanEqualOrderByAttemptAtAsc(
                        identifier, windowStart(now))
                .map(oldest -> Duration.between(now, oldest.getAttemptAt().plus(window)))
                .filter(remaining -> !remaining.isNegative())
                .orElse(Duration.ZERO);
    }

    private OffsetDateTime windowStart(OffsetDateTime now) {
        return now.minus(window);
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
