package com.mqol.access;

import java.util.Optional;

/**
 * Result of {@link AccessDecisionService#decide}. Either an allow carrying the tenant and the
 * actor's role, or a deny carrying a {@link DenyReason}.
 */
public final class AccessDecision {

    private final boolean allowed;
    private final DenyReason reason;
    private final Tenant tenant;
    private final String actorId;
    private final Role role;
    private final Resource resource;
    private final Action action;

    private AccessDecision(boolean allowed, DenyReason reason, Tenant tenant, String actorId,
                           Role role, Resource resource, Action action) {
        this.allowed = allowed;
        this.reason = reason;
        this.tenant = tenant;
        this.actorId = actorId;
        this.role = role;
        this.resource = resource;
        this.action = action;
    }

    static AccessDecision allow(Tenant tenant, String actorId, Role role,
                                Resource resource, Action action) {
        return new AccessDecision(true, null, tenant, actorId, role, resource, action);
    }

    static AccessDecision deny(DenyReason reason, Tenant tenant, String actorId, Role role,
                               Resource resource, Action action) {
        return new AccessDecision(false, reason, tenant, actorId, role, resource, action);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public Optional<DenyReason> reason() {
        return Optional.ofNullable(reason);
    }

    public Tenant tenant() {
        return tenant;
    }

    public String actorId() {
        return actorId;
    }

    /** The actor's role; empty when the actor is not a member. */
    public Optional<Role> role() {
        return Optional.ofNullable(role);
    }

    public Resource resource() {
        return resource;
    }

    public Action action() {
        return action;
    }

    /**
     * @throws IllegalStateException if this decision is a denial
     */
    public TeamScope scope() {
        if (!allowed) {
            throw new IllegalStateException("A denied decision has no team scope");
        }
        return new TeamScope(tenant.id(), tenant.slug(), actorId, role);
    }

    /**
     * Returns the scope of an allow decision.
     *
     * @throws AccessDeniedException if this decision is a denial
     */
    public TeamScope requireAllowed() {
        if (!allowed) {
            throw new AccessDeniedException(this);
        }
        return scope();
    }

    @Override
    public String toString() {
        return allowed
                ? "Allow[tenant=%s, actor=%s, role=%s, %s:%s]".formatted(
                        tenant.id(), actorId, role.value(), resource.key(), action.value())
                : "Deny[%s, tenant=%s, actor=%s, %s:%s]".formatted(
                        reason.code(), tenant.id(), actorId, resource.key(), action.value());
    }
}
