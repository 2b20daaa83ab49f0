package com.tempo.infrastructure.user;

import com.tempo.domain.auth.DuplicateEmailException;
import com.tempo.domain.model.User;
import com.tempo.domain.port.CredentialStore;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;

/**
 * Adapter: exposes the users table to the authentication layer via CredentialStore.
 *
 * Lookups are exact matches: emails and names are compared as stored.
 * Each call runs in its own read or write transaction unless the caller already has one.
 *
 * A concurrent registration that loses the race on uk_users_email surfaces as
 * DuplicateEmailException; any other constraint violation is rethrown unchanged.
 */
@Component
public class JpaCredentialStore implements CredentialStore {

  private final UserRepository users;

  public JpaCredentialStore(UserRepository users) {
    this.users = users;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<User> findByEmail(String email) {
    if (email == null || email.isBlank()) return Optional.empty();
    return users.findByEmail(email).map(UserEntity::toModel);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<User> findByName(String name) {
    if (name == null || name.isBlank()) return Optional.empty();
    return users.findByName(name).map(UserEntity::toModel);
  }

  @Override
  @Transactional(readOnly = true)
  public boolean existsByEmail(String email) {
    return email != null && users.existsByEmail(email);
  }

  @Override
  @Transactional
  public User insert(User user) {
    // saveAndFlush so unique violations surface here, not at commit of an outer transaction
    try {
      return users.saveAndFlush(UserEntity.from(user)).toModel();
    } catch (DataIntegrityViolationException e) {
      if (violates(e, UserEntity.EMAIL_CONSTRAINT)) {
        throw new DuplicateEmailException(e);
      }
      throw e;
    }
  }

  /**
   * Drivers report the constraint name in the message (H2 upper-cases it and appends an index suffix).
   */
  static boolean violates(Throwable e, String constraint) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      String msg = t.getMessage();
      if (msg != null && msg.toLowerCase(Locale.ROOT).contains(constraint)) return true;
    }
    return false;
  }
}
