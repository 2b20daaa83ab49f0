package com.tempo.domain.auth;

import java.util.UUID;

public final class OwnershipViolationException extends AuthException {

    private final UUID userId;
    private final UUID ownerId;

    public OwnershipViolationException(UUID userId, UUID ownerId) {
        super("Not the owner of this resource");
        this.userId = userId;
        this.ownerId = ownerId;
    }

    public UUID userId() {
        return userId;
    }

    public UUID ownerId() {
        return ownerId;
    }
}
