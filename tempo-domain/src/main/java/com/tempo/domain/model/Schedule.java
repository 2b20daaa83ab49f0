package com.tempo.domain.model;

import java.time.Instant;
import java.util.UUID;

public record Schedule(
        UUID id,
        UUID owner,
        UUID databaseId,
        String title,
        String description,
        Instant startsAt,
        Instant endsAt,
        Instant createdAt
) {}
