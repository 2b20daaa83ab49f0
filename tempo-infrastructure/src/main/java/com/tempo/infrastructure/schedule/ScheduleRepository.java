package com.tempo.infrastructure.schedule;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface ScheduleRepository extends JpaRepository<ScheduleEntity, UUID> {

  List<ScheduleEntity> findByOwnerOrderByStartsAtAsc(UUID owner);

  /**
   * @return number of rows removed (0 or 1)
   */
  @Modifying
  @Query("delete from ScheduleEntity s where s.id = :id")
  int deleteScheduleById(@Param("id") UUID id);
}
