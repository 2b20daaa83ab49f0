package com.tempo.api.security;

import com.tempo.domain.model.User;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;

/**
 * Authenticated request: the principal is the live {@link User} resolved from the token subject.
 */
public final class UserAuthenticationToken extends AbstractAuthenticationToken {

  private final User user;
  private String token;

  public UserAuthenticationToken(User user, String token) {
    super(AuthorityUtils.createAuthorityList("ROLE_USER"));
    this.user = user;
    this.token = token;
    setAuthenticated(true);
  }

  @Override
  public User getPrincipal() {
    return user;
  }

  @Override
  public String getCredentials() {
    return token;
  }

  @Override
  public String getName() {
    return user.email();
  }

  @Override
  public void eraseCredentials() {
    super.eraseCredentials();
    this.token = null;
  }
}
