package com.tempo.domain.auth;

/**
 * Base type for authentication and ownership failures.
 * None of them are retried; each one ends the request.
 */
public abstract class AuthException extends RuntimeException {

    protected AuthException(String message) {
        super(message);
    }

    protected AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
