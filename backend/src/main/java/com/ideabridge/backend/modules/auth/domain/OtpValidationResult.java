package com.ideabridge.backend.modules.auth.domain;

import java.util.UUID;

/**
 * Outcome of checking a submitted code. Wrong and already-used codes both map to {@link Status#INVALID}.
 */
public final class OtpValidationResult {

    public enum Status {
        VALID,
        INVALID,
        EXPIRED
    }

    public static final String INVALID_REASON = "Invalid OTP code";
    public static final String EXPIRED_REASON = "OTP has expired";

    private final Status status;
    private final UUID otpId;
    private final String reason;

    private OtpValidationResult(Status status, UUID otpId, String reason) {
        this.status = status;
        this.otpId = otpId;
        this.reason = reason;
    }

    public static OtpValidationResult valid(UUID otpId) {
        return new OtpValidationResult(Status.VALID, otpId, null);
    }

    public static OtpValidationResult invalid() {
        return new OtpValidationResult(Status.INVALID, null, INVALID_REASON);
    }

    public static OtpValidationResult expired() {
        return new OtpValidationResult(Status.EXPIRED, null, EXPIRED_REASON);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isValid() {
        return status == Status.VALID;
    }

    public UUID getOtpId() {
        return otpId;
    }

    public String getReason() {
        return reason;
    }
}
