package com.tempo.domain.port;

import com.tempo.domain.model.User;

import java.util.Optional;

/**
 * Persisted user records as seen by the authentication layer.
 *
 * Implementations are expected to enforce unique email and unique name.
 */
public interface CredentialStore {

    Optional<User> findByEmail(String email);

    Optional<User> findByName(String name);

    boolean existsByEmail(String email);

    /**
     * Inserts a new user. A name or email collision is reported by the
     * underlying store as its own persistence failure.
     */
    User insert(User user);
}
