package com.tempo.api.auth;

import com.tempo.domain.auth.InvalidCredentialsException;
import com.tempo.domain.auth.LoginIdentifier;
import com.tempo.domain.model.User;
import com.tempo.domain.port.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves a login identifier (email or user name) and checks the secret.
 *
 * Unknown identifier and wrong secret both end in {@link InvalidCredentialsException}
 * so callers cannot probe which accounts exist.
 */
@Component
public class CredentialAuthenticator {

  private static final Logger log = LoggerFactory.getLogger(CredentialAuthenticator.class);

  private final CredentialStore credentials;
  private final PasswordVerifier passwords;

  public CredentialAuthenticator(CredentialStore credentials, PasswordVerifier passwords) {
    this.credentials = credentials;
    this.passwords = passwords;
  }

  public User authenticate(String identifier, String secret) {
    LoginIdentifier id = LoginIdentifier.classify(identifier);

    Optional<User> found = id.isEmail()
        ? credentials.findByEmail(id.value())
        : credentials.findByName(id.value());

    User user = found.orElse(null);
    if (user == null || !passwords.verify(secret, user.password())) {
      log.warn("[AUTH] login rejected via={}", id.kind());
      throw new InvalidCredentialsException();
    }

    log.info("[AUTH] login ok userId={} via={}", user.id(), id.kind());
    return user;
  }
}
