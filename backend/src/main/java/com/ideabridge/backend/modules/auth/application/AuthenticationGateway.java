package com.ideabridge.backend.modules.auth.application;

import java.time.Duration;

import com.ideabridge.backend.global.error.RateLimitedException;
import com.ideabridge.backend.modules.auth.domain.AuthSession;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Rate-limited front door for the attempt-based flows.
 * <p>
 * Each call checks the limiter for the supplied identifier first; a blocked call is itself recorded as
 * a failure. Rejected attempts count toward the limit, successful logins are recorded with the user id.
 * A successful OTP request records nothing because nobody has authenticated yet. Any failure of the
 * wrapped call counts, not only authentication errors.
 */
@Service
public class AuthenticationGateway {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationGateway.class);

    static final String MISSING_IDENTIFIER = "(none)";

    private final AuthenticationService authenticationService;
    private final LoginRateLimiter loginRateLimiter;

    public AuthenticationGateway(AuthenticationService authenticationService, LoginRateLimiter loginRateLimiter) {
        this.authenticationService = authenticationService;
        this.loginRateLimiter = loginRateLimiter;
    }

    public void requestOtp(String mobileNumber) {
        String key = attemptKey(mobileNumber);
        ensureNotLimited(key);
        try {
            authenticationService.requestOtp(mobileNumber);
        } catch (RuntimeException e) {
            loginRateLimiter.recordAttempt(key, false, null);
            throw e;
        }
    }

    public AuthSession verifyOtp(String mobileNumber, String code) {
        String key = attemptKey(mobileNumber);
        ensureNotLimited(key);
        AuthSession session;
        try {
            session = authenticationService.verifyOtp(mobileNumber, code);
        } catch (RuntimeException e) {
            loginRateLimiter.recordAttempt(key, false, null);
            throw e;
        }
        loginRateLimiter.recordAttempt(key, true, session.userId());
        return session;
    }

    public AuthSession loginWithCredentials(String username, String password) {
        String key = attemptKey(username);
        ensureNotLimited(key);
        AuthSession session;
        try {
            session = authenticationService.loginWithCredentials(username, password);
        } catch (RuntimeException e) {
            loginRateLimiter.recordAttempt(key, false, null);
            throw e;
        }
        loginRateLimiter.recordAttempt(key, true, session.userId());
        return session;
    }

    /**
     * Attempts without an identifier share one bucket.
     */
    static String attemptKey(String identifier) {
        return identifier == null ? MISSING_IDENTIFIER : identifier;
    }

    private void ensureNotLimited(String identifier) {
        if (!loginRateLimiter.isRateLimited(identifier)) {
            return;
        }
        loginRateLimiter.recordAttempt(identifier, false, null);
        Duration retryAfter = loginRateLimiter.retryAfter(identifier);
        log.warn("Rate limit exceeded for {}; retry after {}s", identifier, retryAfter.toSeconds());
        throw new RateLimitedException(retryAfter.toSeconds());
    }
}
