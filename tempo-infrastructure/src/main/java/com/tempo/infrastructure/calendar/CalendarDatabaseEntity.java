package com.tempo.infrastructure.calendar;

import com.tempo.domain.model.CalendarDatabase;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "calendar_databases", indexes = {
  @Index(name = "ix_calendar_databases_owner", columnList = "owner_id")
})
public class CalendarDatabaseEntity {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "owner_id", nullable = false)
  private UUID owner;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "description", length = 1000)
  private String description;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  public CalendarDatabaseEntity() {}

  public UUID getId() { return id; }
  public void setId(UUID id) { this.id = id; }

  public UUID getOwner() { return owner; }
  public void setOwner(UUID owner) { this.owner = owner; }

  public String getName() { return name; }
  public void setName(String name) { this.name = name; }

  public String getDescription() { return description; }
  public void setDescription(String description) { this.description = description; }

  public Instant getCreatedAt() { return createdAt; }
  public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

  public CalendarDatabase toModel() {
    return new CalendarDatabase(id, owner, name, description, createdAt);
  }

  @PrePersist
  void prePersist() {
    if (createdAt == null) createdAt = Instant.now();
    if (id == null) id = UUID.randomUUID();
  }
}
