package com.tempo.domain.auth;

/**
 * Token was valid but its subject no longer maps to a user.
 */
public final class UserNotFoundException extends AuthException {

    private final String subject;

    public UserNotFoundException(String subject) {
        super("User not found " + subject);
        this.subject = subject;
    }

    public String subject() {
        return subject;
    }
}
