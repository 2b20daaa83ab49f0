package com.tempo.domain.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Registered account.
 *
 * email is the token subject; name is the alternative login identifier.
 * password holds whatever the active password encoding stored at registration.
 */
public record User(
        UUID id,
        String name,
        String email,
        String password
) {
    public User {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(email, "email");
    }

    @Override
    public String toString() {
        // never print the stored secret
        return "User[id=" + id + ", name=" + name + ", email=" + email + "]";
    }
}
