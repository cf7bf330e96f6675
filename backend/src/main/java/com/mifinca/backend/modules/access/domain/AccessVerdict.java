package com.mifinca.backend.modules.access.domain;

/**
 * Outcome of a policy evaluation. {@code reason} is meant for logs only and never reaches the client.
 */
public record AccessVerdict(boolean allowed, ResourcePolicy policy, AccessOperation operation, String reason) {

    public static AccessVerdict allow(ResourcePolicy policy, AccessOperation operation, String reason) {
        return new AccessVerdict(true, policy, operation, reason);
    }

    public static AccessVerdict deny(ResourcePolicy policy, AccessOperation operation, String reason) {
        return new AccessVerdict(false, policy, operation, reason);
    }

    public boolean denied() {
        return !allowed;
    }
}
