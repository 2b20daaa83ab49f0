package com.tempo.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Named namespace of schedules, owned by a single user.
 */
public record CalendarDatabase(
        UUID id,
        UUID owner,
        String name,
        String description,
        Instant createdAt
) {
    /**
     * Database names are stored with spaces replaced by underscores.
     */
    public static String normalizeName(String name) {
        return name == null ? null : name.replace(' ', '_');
    }
}
