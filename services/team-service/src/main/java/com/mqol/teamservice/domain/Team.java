package com.mqol.teamservice.domain;

import com.mqol.access.Tenant;

import java.time.Instant;
import java.util.Map;

/**
 * A team (tenant). {@code id} and {@code slug} never change after creation.
 */
public record Team(
        String id,
        String slug,
        String name,
        Map<String, Boolean> features,
        Instant createdAt,
        Instant updatedAt) {

    public Team {
        features = features == null ? Map.of() : Map.copyOf(features);
    }

    public Tenant toTenant() {
        return new Tenant(id, slug, name, features);
    }
}
