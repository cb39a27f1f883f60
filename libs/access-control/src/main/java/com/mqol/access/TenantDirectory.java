package com.mqol.access;

import java.util.Optional;

/**
 * Read access to tenants. Implemented by the hosting service's storage.
 */
public interface TenantDirectory {

    Optional<Tenant> findById(String tenantId);

    Optional<Tenant> findBySlug(String slug);

    default Optional<Tenant> find(TenantIdentifier identifier) {
        return switch (identifier.kind()) {
            case ID -> findById(identifier.value());
            case SLUG -> findBySlug(identifier.value());
        };
    }
}
