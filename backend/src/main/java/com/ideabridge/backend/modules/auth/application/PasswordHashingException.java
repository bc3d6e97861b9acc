package com.ideabridge.backend.modules.auth.application;

public class PasswordHashingException extends RuntimeException {

    public PasswordHashingException(String message) {
        super(message);
    }

    public PasswordHashingException(String message, Throwable cause) {
        super(message, cause);
    }
}
