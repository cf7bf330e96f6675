package com.mifinca.backend.modules.access.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Authenticated caller as seen by the access core.
 */
public record Actor(UUID userId, boolean active, boolean superuser) {

    public Actor {
        Objects.requireNonNull(userId, "userId");
    }

    public boolean is(UUID otherUserId) {
        return otherUserId != null && userId.equals(otherUserId);
    }
}
