package com.mqol.access;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link MembershipResolver#resolve}: the canonical tenant, and the actor's
 * membership in it if one exists.
 */
public final class MembershipResolution {

    private final Tenant tenant;
    private final Membership membership;

    private MembershipResolution(Tenant tenant, Membership membership) {
        this.tenant = Objects.requireNonNull(tenant, "tenant");
        this.membership = membership;
    }

    public static MembershipResolution member(Tenant tenant, Membership membership) {
        return new MembershipResolution(tenant, Objects.requireNonNull(membership, "membership"));
    }

    public static MembershipResolution notAMember(Tenant tenant) {
        return new MembershipResolution(tenant, null);
    }

    public Tenant tenant() {
        return tenant;
    }

    public boolean isMember() {
        return membership != null;
    }

    public Optional<Membership> membership() {
        return Optional.ofNullable(membership);
    }

    public Optional<Role> role() {
        return membership().map(Membership::role);
    }

    @Override
    public String toString() {
        return "MembershipResolution[tenant=%s, role=%s]".formatted(
                tenant.id(), membership == null ? "none" : membership.role().value());
    }
}
