package com.mqol.access;

import java.util.Locale;

/**
 * Names a tenant either by its stable id or by its URL slug.
 */
public record TenantIdentifier(Kind kind, String value) {

    public enum Kind {
        ID,
        SLUG
    }

    public TenantIdentifier {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("tenant identifier must not be blank");
        }
    }

    public static TenantIdentifier byId(String id) {
        return new TenantIdentifier(Kind.ID, id);
    }

    public static TenantIdentifier bySlug(String slug) {
        return new TenantIdentifier(Kind.SLUG, slug);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + value;
    }
}
