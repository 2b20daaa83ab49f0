package com.tempo.api.security;

import java.time.Clock;
import java.time.Instant;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2ErrorCodes;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Rejects tokens whose exp is missing or not after now. No leeway.
 */
final class ExpiryValidator implements OAuth2TokenValidator<Jwt> {

  private final Clock clock;

  ExpiryValidator(Clock clock) {
    this.clock = clock;
  }

  @Override
  public OAuth2TokenValidatorResult validate(Jwt jwt) {
    Instant exp = jwt.getExpiresAt();
    if (exp == null) {
      return fail("Token has no expiry");
    }
    if (!clock.instant().isBefore(exp)) {
      return fail("Token expired at " + exp);
    }
    return OAuth2TokenValidatorResult.success();
  }

  private static OAuth2TokenValidatorResult fail(String description) {
    return OAuth2TokenValidatorResult.failure(new OAuth2Error(OAuth2ErrorCodes.INVALID_TOKEN, description, null));
  }
}
