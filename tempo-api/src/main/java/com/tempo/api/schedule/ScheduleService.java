package com.tempo.api.schedule;

import com.tempo.api.calendar.CalendarDatabaseService;
import com.tempo.api.security.TempoSecurityProperties;
import com.tempo.domain.auth.OwnershipGuard;
import com.tempo.domain.model.Schedule;
import com.tempo.domain.model.User;
import com.tempo.infrastructure.schedule.ScheduleEntity;
import com.tempo.infrastructure.schedule.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class ScheduleService {

  private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

  private final ScheduleRepository schedules;
  private final CalendarDatabaseService databases;
  private final TempoSecurityProperties security;
  private final Clock clock;

  public ScheduleService(
      ScheduleRepository schedules,
      CalendarDatabaseService databases,
      TempoSecurityProperties security,
      Clock clock
  ) {
    this.schedules = schedules;
    this.databases = databases;
    this.security = security;
    this.clock = clock;
  }

  /**
   * Owner stamped from the caller; the target database must belong to the caller as well.
   */
  @Transactional
  public Schedule create(User owner, UUID databaseId, String title, String description, Instant startsAt, Instant endsAt) {
    databases.requireOwned(owner, databaseId);

    ScheduleEntity e = new ScheduleEntity();
    e.setId(UUID.randomUUID());
    e.setOwner(owner.id());
    e.setDatabaseId(databaseId);
    e.setTitle(title);
    e.setDescription(description);
    e.setStartsAt(startsAt);
    e.setEndsAt(endsAt);
    e.setCreatedAt(clock.instant());

    Schedule saved = schedules.save(e).toModel();
    log.info("[SCHEDULE] created scheduleId={} databaseId={} owner={}", saved.id(), databaseId, saved.owner());
    return saved;
  }

  @Transactional(readOnly = true)
  public List<Schedule> listOwned(User owner) {
    return schedules.findByOwnerOrderByStartsAtAsc(owner.id()).stream()
        .map(ScheduleEntity::toModel)
        .toList();
  }

  /**
   * Deletes by id.
   *
   * With tempo.security.open-schedule-delete=true (default) there is no caller and no owner check:
   * anyone who knows the id can delete. Otherwise the caller must own the schedule.
   *
   * @return rows removed (0 when the id is unknown)
   */
  @Transactional
  public int delete(UUID scheduleId, User caller) {
    if (!security.openScheduleDelete()) {
      ScheduleEntity existing = schedules.findById(scheduleId).orElse(null);
      if (existing == null) return 0;
      OwnershipGuard.requireOwner(caller, existing.getOwner());
    }
    int removed = schedules.deleteScheduleById(scheduleId);
    log.info("[SCHEDULE] delete scheduleId={} removed={} caller={}",
        scheduleId, removed, caller == null ? "anonymous" : caller.id());
    return removed;
  }
}
