package com.tempo.domain.auth;

/**
 * Login failed. Unknown identifier and wrong secret are deliberately the same failure.
 */
public final class InvalidCredentialsException extends AuthException {

    public InvalidCredentialsException() {
        super("Incorrect email or password");
    }
}
