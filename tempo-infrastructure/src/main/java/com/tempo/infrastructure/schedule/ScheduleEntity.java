package com.tempo.infrastructure.schedule;

import com.tempo.domain.model.Schedule;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "schedules", indexes = {
  @Index(name = "ix_schedules_owner", columnList = "owner_id"),
  @Index(name = "ix_schedules_database", columnList = "database_id")
})
public class ScheduleEntity {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "owner_id", nullable = false)
  private UUID owner;

  @Column(name = "database_id", nullable = false)
  private UUID databaseId;

  @Column(name = "title", nullable = false, length = 200)
  private String title;

  @Column(name = "description", length = 2000)
  private String description;

  @Column(name = "starts_at", nullable = false)
  private Instant startsAt;

  @Column(name = "ends_at", nullable = false)
  private Instant endsAt;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  public ScheduleEntity() {}

  public UUID getId() { return id; }
  public void setId(UUID id) { this.id = id; }

  public UUID getOwner() { return owner; }
  public void setOwner(UUID owner) { this.owner = owner; }

  public UUID getDatabaseId() { return databaseId; }
  public void setDatabaseId(UUID databaseId) { this.databaseId = databaseId; }

  public String getTitle() { return title; }
  public void setTitle(String title) { this.title = title; }

  public String getDescription() { return description; }
  public void setDescription(String description) { this.description = description; }

  public Instant getStartsAt() { return startsAt; }
  public void setStartsAt(Instant startsAt) { this.startsAt = startsAt; }

  public Instant getEndsAt() { return endsAt; }
  public void setEndsAt(Instant endsAt) { this.endsAt = endsAt; }

  public Instant getCreatedAt() { return createdAt; }
  public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

  public Schedule toModel() {
    return new Schedule(id, owner, databaseId, title, description, startsAt, endsAt, createdAt);
  }

  @PrePersist
  void prePersist() {
    if (createdAt == null) createdAt = Instant.now();
    if (id == null) id = UUID.randomUUID();
  }
}
