package com.tempo.api.calendar;

import com.tempo.api.common.ResourceNotFoundException;
import com.tempo.domain.auth.OwnershipGuard;
import com.tempo.domain.model.CalendarDatabase;
import com.tempo.domain.model.User;
import com.tempo.infrastructure.calendar.CalendarDatabaseEntity;
import com.tempo.infrastructure.calendar.CalendarDatabaseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Service
public class CalendarDatabaseService {

  private static final Logger log = LoggerFactory.getLogger(CalendarDatabaseService.class);

  private final CalendarDatabaseRepository databases;
  private final Clock clock;

  public CalendarDatabaseService(CalendarDatabaseRepository databases, Clock clock) {
    this.databases = databases;
    this.clock = clock;
  }

  /**
   * The owner is always the caller; spaces in the name become underscores.
   */
  @Transactional
  public CalendarDatabase create(User owner, String name, String description) {
    CalendarDatabaseEntity e = new CalendarDatabaseEntity();
    e.setId(UUID.randomUUID());
    e.setOwner(owner.id());
    e.setName(CalendarDatabase.normalizeName(name));
    e.setDescription(description);
    e.setCreatedAt(clock.instant());

    CalendarDatabase saved = databases.save(e).toModel();
    log.info("[DB] created databaseId={} owner={}", saved.id(), saved.owner());
    return saved;
  }

  @Transactional(readOnly = true)
  public List<CalendarDatabase> listOwned(User owner) {
    return databases.findByOwnerOrderByCreatedAtAsc(owner.id()).stream()
        .map(CalendarDatabaseEntity::toModel)
        .toList();
  }

  /**
   * @throws ResourceNotFoundException if no such database
   * @throws com.tempo.domain.auth.OwnershipViolationException if it belongs to someone else
   */
  @Transactional(readOnly = true)
  public CalendarDatabase requireOwned(User user, UUID databaseId) {
    CalendarDatabase db = databases.findById(databaseId)
        .map(CalendarDatabaseEntity::toModel)
        .orElseThrow(() -> new ResourceNotFoundException("Database not found"));
    OwnershipGuard.requireOwner(user, db.owner());
    return db;
  }
}
