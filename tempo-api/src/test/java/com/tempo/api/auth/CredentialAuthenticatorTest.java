package com.tempo.api.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tempo.api.security.PlainTextPasswordEncoder;
import com.tempo.api.support.InMemoryCredentialStore;
import com.tempo.domain.auth.InvalidCredentialsException;
import com.tempo.domain.model.User;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CredentialAuthenticator")
class CredentialAuthenticatorTest {

  private InMemoryCredentialStore store;
  private CredentialAuthenticator authenticator;
  private User alice;

  @BeforeEach
  void setUp() {
    store = new InMemoryCredentialStore();
    authenticator = new CredentialAuthenticator(store, new PasswordVerifier(new PlainTextPasswordEncoder()));
    alice = store.insert(new User(UUID.randomUUID(), "alice", "alice@x.com", "p1"));
  }

  @Test
  @DisplayName("email plus correct secret returns the user")
  void emailLogin() {
    assertThat(authenticator.authenticate("alice@x.com", "p1")).isEqualTo(alice);
  }

  @Test
  @DisplayName("name plus correct secret returns the user")
  void nameLogin() {
    assertThat(authenticator.authenticate("alice", "p1")).isEqualTo(alice);
  }

  @Test
  @DisplayName("wrong secret fails with InvalidCredentials")
  void wrongSecret() {
    assertThatThrownBy(() -> authenticator.authenticate("alice@x.com", "wrong"))
        .isInstanceOf(InvalidCredentialsException.class)
        .hasMessage("Incorrect email or password");
  }

  @Test
  @DisplayName("unknown identifier fails with the same error as a wrong secret")
  void unknownIdentifier() {
    assertThatThrownBy(() -> authenticator.authenticate("bob@x.com", "p1"))
        .isInstanceOf(InvalidCredentialsException.class)
        .hasMessage("Incorrect email or password");
    assertThatThrownBy(() -> authenticator.authenticate("bob", "p1"))
        .isInstanceOf(InvalidCredentialsException.class);
  }

  @Test
  @DisplayName("an email-shaped identifier is never looked up as a name")
  void emailShapedNameNotMatched() {
    store.insert(new User(UUID.randomUUID(), "carol@x.com", "carol@real.org", "p3"));

    assertThatThrownBy(() -> authenticator.authenticate("carol@x.com", "p3"))
        .isInstanceOf(InvalidCredentialsException.class);
  }

  @Test
  @DisplayName("null identifier is a failed login")
  void nullIdentifier() {
    assertThatThrownBy(() -> authenticator.authenticate(null, "p1"))
        .isInstanceOf(InvalidCredentialsException.class);
  }
}
