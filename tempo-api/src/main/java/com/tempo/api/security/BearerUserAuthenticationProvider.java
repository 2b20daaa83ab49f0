package com.tempo.api.security;

import com.tempo.api.auth.AccessTokenValidator;
import com.tempo.api.auth.IdentityResolver;
import com.tempo.domain.auth.InvalidTokenException;
import com.tempo.domain.auth.UserNotFoundException;
import com.tempo.domain.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.AuthenticationProvider;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.server.resource.InvalidBearerTokenException;
import org.springframework.security.oauth2.server.resource.authentication.BearerTokenAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Bearer token -> subject (validator) -> live user (resolver).
 *
 * Both failure kinds become {@link InvalidBearerTokenException} so the resource server answers 401
 * with a WWW-Authenticate challenge. The description differs: an unknown subject is echoed back.
 */
@Component
public class BearerUserAuthenticationProvider implements AuthenticationProvider {

  private static final Logger log = LoggerFactory.getLogger(BearerUserAuthenticationProvider.class);

  private final AccessTokenValidator tokens;
  private final IdentityResolver identities;

  public BearerUserAuthenticationProvider(AccessTokenValidator tokens, IdentityResolver identities) {
    this.tokens = tokens;
    this.identities = identities;
  }

  @Override
  public Authentication authenticate(Authentication authentication) {
    String token = ((BearerTokenAuthenticationToken) authentication).getToken();

    String subject;
    try {
      subject = tokens.validate(token);
    } catch (InvalidTokenException e) {
      throw new InvalidBearerTokenException("Could not validate credentials", e);
    }

    try {
      User user = identities.resolve(subject);
      return new UserAuthenticationToken(user, token);
    } catch (UserNotFoundException e) {
      log.warn("[AUTH] token subject has no user");
      throw new InvalidBearerTokenException(e.getMessage(), e);
    }
  }

  @Override
  public boolean supports(Class<?> authentication) {
    return BearerTokenAuthenticationToken.class.isAssignableFrom(authentication);
  }
}
