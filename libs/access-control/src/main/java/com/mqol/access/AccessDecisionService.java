package com.mqol.access;

import com.mqol.observability.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether an actor may perform an action on a resource inside a tenant.
 * <p>
 * Order: resolve tenant, resolve membership, consult the matrix. A non-member is denied before
 * the matrix is read. Nothing is cached, so a role change or removal applies to the very next
 * call. Apart from the {@code access.decisions} counter and debug logging the call has no side
 * effects.
 */
public final class AccessDecisionService {

    private static final Logger log = LoggerFactory.getLogger(AccessDecisionService.class);

    public static final String METRIC_DECISIONS = "access.decisions";

    private final PermissionMatrix matrix;
    private final MembershipResolver resolver;
    private final MetricFactory metrics;

    public AccessDecisionService(PermissionMatrix matrix, MembershipResolver resolver,
                                 MetricFactory metrics) {
        if (matrix == null || resolver == null || metrics == null) {
            throw new IllegalArgumentException("matrix, resolver and metrics must not be null");
        }
        this.matrix = matrix;
        this.resolver = resolver;
        this.metrics = metrics;
    }

    /**
     * @throws TenantNotFoundException if the identifier matches no tenant
     */
    public AccessDecision decide(String actorId, TenantIdentifier identifier,
                                 Resource resource, Action action) {
        if (resource == null || action == null) {
            throw new IllegalArgumentException("resource and action must not be null");
        }

        MembershipResolution resolution;
        try {
            resolution = resolver.resolve(actorId, identifier);
        } catch (TenantNotFoundException e) {
            log.debug("Access check failed: reason=tenant_not_found tenant={} actor={} {}:{}",
                    identifier, actorId, resource.key(), action.value());
            record("error", "tenant_not_found", resource, action);
            throw e;
        }

        Tenant tenant = resolution.tenant();
        if (!resolution.isMember()) {
            return denied(AccessDecision.deny(DenyReason.NOT_A_MEMBER, tenant, actorId, null,
                    resource, action));
        }

        Role role = resolution.role().orElseThrow();
        if (!matrix.allows(role, resource, action)) {
            return denied(AccessDecision.deny(DenyReason.INSUFFICIENT_ROLE, tenant, actorId, role,
                    resource, action));
        }

        record("allow", "none", resource, action);
        return AccessDecision.allow(tenant, actorId, role, resource, action);
    }

    public PermissionMatrix matrix() {
        return matrix;
    }

    private AccessDecision denied(AccessDecision decision) {
        DenyReason reason = decision.reason().orElseThrow();
        log.debug("Access denied: reason={} tenant={} actor={} role={} {}:{}",
                reason.code(), decision.tenant().id(), decision.actorId(),
                decision.role().map(Role::value).orElse("none"),
                decision.resource().key(), decision.action().value());
        record("deny", reason.code(), decision.resource(), decision.action());
        return decision;
    }

    private void record(String outcome, String reason, Resource resource, Action action) {
        metrics.increment(METRIC_DECISIONS,
                "outcome", outcome,
                "reason", reason,
                "resource", resource.key(),
                "action", action.value());
    }
}
