package com.ideabridge.backend.global.error;

public class RateLimitedException extends AuthException {

    public static final String RATE_LIMITED_MESSAGE = "Too many attempts. Please try again later.";

    private final long retryAfterSeconds;

    public RateLimitedException(long retryAfterSeconds) {
        super(RATE_LIMITED_MESSAGE, AuthErrorCode.RATE_LIMIT_EXCEEDED);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
