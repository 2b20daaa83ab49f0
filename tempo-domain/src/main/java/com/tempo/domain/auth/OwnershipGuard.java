package com.tempo.domain.auth;

import com.tempo.domain.model.User;

import java.util.UUID;

/**
 * Single point of truth for "may this user touch this resource".
 *
 * Rules:
 * - A resource belongs to exactly one user (its stored owner id).
 * - Only that user passes. Missing user or missing owner never passes.
 * - Creation paths stamp the owner instead of checking it.
 */
public final class OwnershipGuard {

    private OwnershipGuard() {}

    public static boolean authorize(User user, UUID resourceOwnerId) {
        if (user == null || resourceOwnerId == null) {
            return false;
        }
        return resourceOwnerId.equals(user.id());
    }

    /**
     * @throws OwnershipViolationException if {@link #authorize} is false
     */
    public static void requireOwner(User user, UUID resourceOwnerId) {
        if (!authorize(user, resourceOwnerId)) {
            throw new OwnershipViolationException(user == null ? null : user.id(), resourceOwnerId);
        }
    }
}
