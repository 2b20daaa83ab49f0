package com.tempo.infrastructure.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

@DataJpaTest
@DisplayName("ScheduleRepository")
class ScheduleRepositoryTest {

  @Autowired ScheduleRepository schedules;

  private ScheduleEntity schedule(UUID owner, String title, Instant start) {
    ScheduleEntity e = new ScheduleEntity();
    e.setOwner(owner);
    e.setDatabaseId(UUID.randomUUID());
    e.setTitle(title);
    e.setStartsAt(start);
    e.setEndsAt(start.plusSeconds(3600));
    return e;
  }

  @Test
  @DisplayName("lists only the owner's schedules, earliest first")
  void listsByOwner() {
    UUID alice = UUID.randomUUID();
    UUID bob = UUID.randomUUID();
    schedules.save(schedule(alice, "late", Instant.parse("2024-01-02T10:00:00Z")));
    schedules.save(schedule(alice, "early", Instant.parse("2024-01-01T10:00:00Z")));
    schedules.save(schedule(bob, "bob's", Instant.parse("2024-01-01T09:00:00Z")));

    assertThat(schedules.findByOwnerOrderByStartsAtAsc(alice))
        .extracting(ScheduleEntity::getTitle)
        .containsExactly("early", "late");
  }

  @Test
  @DisplayName("delete by id reports how many rows were removed")
  void deleteCount() {
    ScheduleEntity saved = schedules.saveAndFlush(schedule(UUID.randomUUID(), "x", Instant.now()));

    assertThat(schedules.deleteScheduleById(saved.getId())).isEqualTo(1);
    assertThat(schedules.deleteScheduleById(saved.getId())).isZero();
  }
}
