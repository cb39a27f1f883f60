package com.mqol.access;

/**
 * Looks up an actor's membership in a tenant. Read-only: it never creates memberships.
 */
public final class MembershipResolver {

    private final TenantDirectory tenants;
    private final MembershipStore memberships;

    public MembershipResolver(TenantDirectory tenants, MembershipStore memberships) {
        if (tenants == null || memberships == null) {
            throw new IllegalArgumentException("tenants and memberships must not be null");
        }
        this.tenants = tenants;
        this.memberships = memberships;
    }

    /**
     * @return the tenant with the actor's membership, or a not-a-member resolution
     * @throws TenantNotFoundException if the identifier matches no tenant
     */
    public MembershipResolution resolve(String actorId, TenantIdentifier identifier) {
        if (actorId == null || actorId.isBlank()) {
            throw new IllegalArgumentException("actorId must not be blank");
        }
        if (identifier == null) {
            throw new IllegalArgumentException("identifier must not be null");
        }
        Tenant tenant = tenants.find(identifier)
                .orElseThrow(() -> new TenantNotFoundException(identifier));
        return memberships.find(tenant.id(), actorId)
                .map(m -> MembershipResolution.member(tenant, m))
                .orElseGet(() -> MembershipResolution.notAMember(tenant));
    }
}
