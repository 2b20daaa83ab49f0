package com.tempo.infrastructure.calendar;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface CalendarDatabaseRepository extends JpaRepository<CalendarDatabaseEntity, UUID> {

  List<CalendarDatabaseEntity> findByOwnerOrderByCreatedAtAsc(UUID owner);
}
