package com.ideabridge.backend.global.error;

import org.springframework.http.HttpStatus;

public enum AuthErrorCode {

    AUTH_FAILED(HttpStatus.UNAUTHORIZED),
    OTP_INVALID(HttpStatus.UNAUTHORIZED),
    OTP_EXPIRED(HttpStatus.UNAUTHORIZED),
    OTP_SEND_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    REGISTRATION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    DUPLICATE_ERROR(HttpStatus.CONFLICT),
    RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS);

    private final HttpStatus status;

    AuthErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
