package com.tempo.infrastructure.user;

import com.tempo.domain.model.User;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "users", uniqueConstraints = {
    @UniqueConstraint(name = UserEntity.EMAIL_CONSTRAINT, columnNames = "email"),
    @UniqueConstraint(name = UserEntity.NAME_CONSTRAINT, columnNames = "name")
})
public class UserEntity {

  static final String EMAIL_CONSTRAINT = "uk_users_email";
  static final String NAME_CONSTRAINT = "uk_users_name";

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "name", nullable = false, length = 100)
  private String name;

  @Column(name = "email", nullable = false, length = 320)
  private String email;

  // plain or bcrypt, depending on tempo.auth.password-encoding
  @Column(name = "password", nullable = false, length = 100)
  private String password;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected UserEntity() {}

  public UserEntity(UUID id, String name, String email, String password, Instant createdAt) {
    this.id = id;
    this.name = name;
    this.email = email;
    this.password = password;
    this.createdAt = createdAt;
  }

  public static UserEntity from(User user) {
    return new UserEntity(user.id(), user.name(), user.email(), user.password(), Instant.now());
  }

  public User toModel() {
    return new User(id, name, email, password);
  }

  public UUID getId() { return id; }
  public String getName() { return name; }
  public String getEmail() { return email; }
  public String getPassword() { return password; }
  public Instant getCreatedAt() { return createdAt; }
}
