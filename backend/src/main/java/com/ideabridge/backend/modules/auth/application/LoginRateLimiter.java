package com.ideabridge.backend.modules.auth.application;

import java.time.Duration;
import java.util.UUID;

/**
 * Throttles repeated authentication attempts per caller-supplied identifier (username or mobile number).
 */
public interface LoginRateLimiter {

    boolean isRateLimited(String identifier);

    void recordAttempt(String identifier, boolean success, UUID userId);

    /**
     * Time until the identifier drops below the limit again. {@link Duration#ZERO} when it is not limited.
     */
    Duration retryAfter(String identifier);
}
