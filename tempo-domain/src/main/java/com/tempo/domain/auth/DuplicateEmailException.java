package com.tempo.domain.auth;

public final class DuplicateEmailException extends AuthException {

    public DuplicateEmailException() {
        super("Email already registered");
    }

    public DuplicateEmailException(Throwable cause) {
        super("Email already registered", cause);
    }
}
