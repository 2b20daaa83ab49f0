package com.tempo.api.auth;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Compares a supplied secret with the stored one using the configured {@link PasswordEncoder}.
 *
 * With tempo.auth.password-encoding=plain (the default) this is a direct string
 * comparison against the value stored at registration; it is neither hashed nor
 * timing-safe. bcrypt switches both storage and comparison to BCrypt.
 */
@Component
public class PasswordVerifier {

  private final PasswordEncoder encoder;

  public PasswordVerifier(PasswordEncoder encoder) {
    this.encoder = encoder;
  }

  public boolean verify(String supplied, String stored) {
    if (supplied == null || stored == null) return false;
    return encoder.matches(supplied, stored);
  }

  /** Value to persist for a newly registered password. */
  public String encodeForStorage(String raw) {
    return encoder.encode(raw);
  }
}
