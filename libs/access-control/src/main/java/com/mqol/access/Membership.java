package com.mqol.access;

/**
 * One actor's role in one tenant. At most one exists per (actor, tenant).
 */
public record Membership(String actorId, String tenantId, Role role) {

    public Membership {
        if (actorId == null || actorId.isBlank()) {
            throw new IllegalArgumentException("actorId must not be blank");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
    }
}
