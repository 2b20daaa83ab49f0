package com.tempo.api.auth;

import com.tempo.domain.auth.InvalidTokenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;

/**
 * Verifies signature, expiry and subject of a presented access token.
 *
 * Every failure collapses into {@link InvalidTokenException}; the reason only goes to the debug log.
 */
@Component
public class AccessTokenValidator {

  private static final Logger log = LoggerFactory.getLogger(AccessTokenValidator.class);

  private final JwtDecoder jwtDecoder;

  public AccessTokenValidator(JwtDecoder jwtDecoder) {
    this.jwtDecoder = jwtDecoder;
  }

  /**
   * @return the subject claim (email recorded at issuance)
   */
  public String validate(String token) {
    if (token == null || token.isBlank()) {
      throw new InvalidTokenException("Missing token");
    }
    Jwt jwt;
    try {
      jwt = jwtDecoder.decode(token);
    } catch (JwtException e) {
      log.debug("[AUTH] token rejected: {}", e.getMessage());
      throw new InvalidTokenException("Could not validate credentials", e);
    }
    return jwt.getSubject();
  }
}
