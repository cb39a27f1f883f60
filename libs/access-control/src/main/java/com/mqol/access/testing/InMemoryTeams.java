package com.mqol.access.testing;

import com.mqol.access.Membership;
import com.mqol.access.MembershipStore;
import com.mqol.access.Role;
import com.mqol.access.Tenant;
import com.mqol.access.TenantDirectory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link TenantDirectory} and {@link MembershipStore} for tests.
 * <p>
 * WHY in src/main: other modules use it from their test scope through the ordinary Maven
 * dependency, without a test-jar.
 */
public final class InMemoryTeams implements TenantDirectory, MembershipStore {

    private final Map<String, Tenant> tenantsById = new ConcurrentHashMap<>();
    private final Map<String, Membership> memberships = new ConcurrentHashMap<>();

    public Tenant addTeam(String id, String slug) {
        return addTeam(new Tenant(id, slug, slug, Map.of()));
    }

    public Tenant addTeam(Tenant tenant) {
        tenantsById.put(tenant.id(), tenant);
        return tenant;
    }

    /**
     * Adds a membership.
     *
     * @throws IllegalStateException if the actor already belongs to the tenant
     */
    public Membership addMember(String tenantId, String actorId, Role role) {
        Membership membership = new Membership(actorId, tenantId, role);
        if (memberships.putIfAbsent(key(tenantId, actorId), membership) != null) {
            throw new IllegalStateException(
                    "Actor '%s' is already a member of '%s'".formatted(actorId, tenantId));
        }
        return membership;
    }

    public void changeRole(String tenantId, String actorId, Role role) {
        memberships.computeIfPresent(key(tenantId, actorId),
                (k, current) -> new Membership(actorId, tenantId, role));
    }

    public void removeMember(String tenantId, String actorId) {
        memberships.remove(key(tenantId, actorId));
    }

    @Override
    public Optional<Tenant> findById(String tenantId) {
        return Optional.ofNullable(tenantsById.get(tenantId));
    }

    @Override
    public Optional<Tenant> findBySlug(String slug) {
        return tenantsById.values().stream()
                .filter(t -> t.slug().equals(slug))
                .findFirst();
    }

    @Override
    public Optional<Membership> find(String tenantId, String actorId) {
        return Optional.ofNullable(memberships.get(key(tenantId, actorId)));
    }

    private static String key(String tenantId, String actorId) {
        return tenantId + "\u0000" + actorId;
    }
}
