package com.ideabridge.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Single failure type of the authentication core: a caller-safe message, a machine-readable code and
 * the HTTP status a web layer should answer with. Internal causes are logged where they occur and are
 * never attached here.
 */
public class AuthException extends ResponseStatusException {

    public static final String AUTHENTICATION_FAILED_MESSAGE = "Authentication failed";

    private final AuthErrorCode code;

    public AuthException(String message, AuthErrorCode code) {
        super(code.getStatus(), message);
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("AuthException message must not be blank");
        }
        this.code = code;
    }

    /**
     * The one error used for every unknown-identity and wrong-credential branch, so callers cannot
     * tell which of them happened.
     */
    public static AuthException authenticationFailed() {
        return new AuthException(AUTHENTICATION_FAILED_MESSAGE, AuthErrorCode.AUTH_FAILED);
    }

    public AuthErrorCode getCode() {
        return code;
    }

    public HttpStatus getHttpStatus() {
        return code.getStatus();
    }
}
