package com.mqol.teamservice.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Audit publication settings, bound from {@code mqol.audit.*}.
 *
 * @param enabled whether audit events are published (default true)
 * @param queueCapacity events buffered before new ones are dropped (default 1000)
 * @param producer name stamped on every event; falls back to {@code mqol.service.name}
 */
@ConfigurationProperties(prefix = "mqol.audit")
@Validated
public record AuditProperties(Boolean enabled, @Positive Integer queueCapacity, String producer) {

    public AuditProperties {
        if (enabled == null) {
            enabled = true;
        }
        if (queueCapacity == null) {
            queueCapacity = 1000;
        }
    }
}
