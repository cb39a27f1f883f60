package com.mqol.teamservice.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the team service, bound from {@code mqol.service.*}:
 *
 * <pre>
 * mqol:
 *   service:
 *     name: team-service
 *     environment: production
 *     team-deletion-enabled: false
 *     patients-enabled: true
 *     invitation-ttl: 7d
 *     patient-retention: 2555d
 * </pre>
 *
 * @param name Service name used for logging, metrics and audit events. Required.
 * @param environment Deployment environment (development, staging, production).
 * @param teamDeletionEnabled Whether owners may delete their team (default false).
 * @param patientsEnabled Whether the patient endpoints are served at all (default true).
 * @param invitationTtl How long an invitation token stays valid (default 7 days).
 * @param patientRetention How long a soft-deleted patient is kept (default 7 years).
 */
@ConfigurationProperties(prefix = "mqol.service")
@Validated
public record TeamServiceProperties(
        @NotBlank String name,
        String environment,
        Boolean teamDeletionEnabled,
        Boolean patientsEnabled,
        Duration invitationTtl,
        Duration patientRetention) {

    /**
     * Compact constructor, applies defaults for optional fields. Runs before Bean Validation.
     */
    public TeamServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (teamDeletionEnabled == null) {
            teamDeletionEnabled = false;
        }
        if (patientsEnabled == null) {
            patientsEnabled = true;
        }
        if (invitationTtl == null || invitationTtl.isNegative() || invitationTtl.isZero()) {
            invitationTtl = Duration.ofDays(7);
        }
        if (patientRetention == null || patientRetention.isNegative()) {
            patientRetention = Duration.ofDays(2555);
        }
    }
}
