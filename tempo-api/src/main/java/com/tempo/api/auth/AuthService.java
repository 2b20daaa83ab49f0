package com.tempo.api.auth;

import com.tempo.domain.auth.DuplicateEmailException;
import com.tempo.domain.model.User;
import com.tempo.domain.port.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
public class AuthService {

  private static final Logger log = LoggerFactory.getLogger(AuthService.class);

  private final CredentialStore credentials;
  private final CredentialAuthenticator authenticator;
  private final PasswordVerifier passwords;
  private final AccessTokenService tokens;

  public AuthService(
      CredentialStore credentials,
      CredentialAuthenticator authenticator,
      PasswordVerifier passwords,
      AccessTokenService tokens
  ) {
    this.credentials = credentials;
    this.authenticator = authenticator;
    this.passwords = passwords;
    this.tokens = tokens;
  }

  /**
   * Email uniqueness is checked here; name uniqueness is left to the users table constraint.
   * A registration racing past the check is still reported as DuplicateEmailException by the store.
   * The id is always generated server-side.
   */
  @Transactional
  public User register(String name, String email, String password) {
    if (credentials.existsByEmail(email)) {
      throw new DuplicateEmailException();
    }
    User user = credentials.insert(new User(
        UUID.randomUUID(),
        name,
        email,
        passwords.encodeForStorage(password)
    ));
    log.info("[AUTH] registered userId={}", user.id());
    return user;
  }

  public AccessToken login(String identifier, String secret) {
    User user = authenticator.authenticate(identifier, secret);
    return tokens.issue(user.email());
  }
}
