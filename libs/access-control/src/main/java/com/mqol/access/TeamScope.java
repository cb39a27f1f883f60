package com.mqol.access;

import java.util.Objects;

/**
 * Proof that an actor was allowed to act inside a tenant.
 * <p>
 * Only {@link AccessDecision#scope()} creates instances, so any repository method taking a
 * {@code TeamScope} receives a tenant id that came out of an allow decision rather than from a
 * request payload.
 */
public final class TeamScope {

    private final String tenantId;
    private final String tenantSlug;
    private final String actorId;
    private final Role role;

    TeamScope(String tenantId, String tenantSlug, String actorId, Role role) {
        this.tenantId = tenantId;
        this.tenantSlug = tenantSlug;
        this.actorId = actorId;
        this.role = role;
    }

    public String tenantId() {
        return tenantId;
    }

    public String tenantSlug() {
        return tenantSlug;
    }

    public String actorId() {
        return actorId;
    }

    public Role role() {
        return role;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TeamScope other)) {
            return false;
        }
        return tenantId.equals(other.tenantId)
                && actorId.equals(other.actorId)
                && role == other.role;
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantId, actorId, role);
    }

    @Override
    public String toString() {
        return "TeamScope[tenant=%s, actor=%s, role=%s]".formatted(tenantId, actorId, role.value());
    }
}
