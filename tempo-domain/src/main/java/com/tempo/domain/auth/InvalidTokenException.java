package com.tempo.domain.auth;

/**
 * Bearer token rejected (malformed, bad signature, expired or without subject).
 */
public final class InvalidTokenException extends AuthException {

    public InvalidTokenException(String reason) {
        super(reason);
    }

    public InvalidTokenException(String reason, Throwable cause) {
        super(reason, cause);
    }
}
