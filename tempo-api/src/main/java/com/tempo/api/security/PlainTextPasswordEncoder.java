package com.tempo.api.security;

import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * tempo.auth.password-encoding=plain: secrets are stored as provided and compared with equals.
 */
public final class PlainTextPasswordEncoder implements PasswordEncoder {

  @Override
  public String encode(CharSequence rawPassword) {
    return rawPassword == null ? null : rawPassword.toString();
  }

  @Override
  public boolean matches(CharSequence rawPassword, String encodedPassword) {
    if (rawPassword == null || encodedPassword == null) return false;
    return encodedPassword.equals(rawPassword.toString());
  }
}
