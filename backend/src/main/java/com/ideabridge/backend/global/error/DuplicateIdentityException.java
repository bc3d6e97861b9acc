package com.ideabridge.backend.global.error;

public class DuplicateIdentityException extends AuthException {

    private final String field;

    public DuplicateIdentityException(String field) {
        super(field + " already exists", AuthErrorCode.DUPLICATE_ERROR);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
