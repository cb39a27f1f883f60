package com.mqol.access;

/**
 * Thrown when a tenant identifier resolves to no tenant.
 */
public class TenantNotFoundException extends RuntimeException {

    private final TenantIdentifier identifier;

    public TenantNotFoundException(TenantIdentifier identifier) {
        super("Tenant not found: " + identifier);
        this.identifier = identifier;
    }

    public TenantIdentifier identifier() {
        return identifier;
    }
}
