package com.mqol.access;

import java.util.Map;

/**
 * A team as seen by the access layer: stable id, unique slug, display name and feature flags.
 */
public record Tenant(String id, String slug, String name, Map<String, Boolean> features) {

    public Tenant {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("slug must not be blank");
        }
        features = features == null ? Map.of() : Map.copyOf(features);
    }

    /**
     * Returns the flag's value, or {@code defaultValue} when the team never set it.
     */
    public boolean featureEnabled(String flag, boolean defaultValue) {
        return features.getOrDefault(flag, defaultValue);
    }
}
