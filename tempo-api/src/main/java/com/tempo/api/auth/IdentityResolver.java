package com.tempo.api.auth;

import com.tempo.domain.auth.UserNotFoundException;
import com.tempo.domain.model.User;
import com.tempo.domain.port.CredentialStore;
import org.springframework.stereotype.Component;

/**
 * Maps a validated subject claim back to a live user.
 */
@Component
public class IdentityResolver {

  private final CredentialStore credentials;

  public IdentityResolver(CredentialStore credentials) {
    this.credentials = credentials;
  }

  public User resolve(String subject) {
    return credentials.findByEmail(subject)
        .orElseThrow(() -> new UserNotFoundException(subject));
  }
}
