package com.mqol.audit;

import com.mqol.access.AccessDecision;
import com.mqol.observability.CorrelationContext;
import com.mqol.observability.CorrelationContextHolder;
import com.mqol.observability.SensitiveDataRedactor;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * Builds {@link AuditEvent}s from allowed access decisions.
 * <p>
 * Generates the event id, stamps the time and the current request's correlation id, and redacts
 * the metadata before it leaves the request thread.
 */
public final class AuditEventFactory {

    private final String producer;
    private final SensitiveDataRedactor redactor;
    private final Clock clock;

    public AuditEventFactory(String producer, SensitiveDataRedactor redactor) {
        this(producer, redactor, Clock.systemUTC());
    }

    public AuditEventFactory(String producer, SensitiveDataRedactor redactor, Clock clock) {
        if (producer == null || producer.isBlank()) {
            throw new IllegalArgumentException("producer must not be null or blank");
        }
        if (redactor == null || clock == null) {
            throw new IllegalArgumentException("redactor and clock must not be null");
        }
        this.producer = producer;
        this.redactor = redactor;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException if the decision is a denial
     */
    public AuditEvent fromDecision(AccessDecision decision, AuditAction action, Map<String, ?> metadata) {
        if (decision == null || action == null) {
            throw new IllegalArgumentException("decision and action must not be null");
        }
        if (!decision.isAllowed()) {
            throw new IllegalArgumentException("Denied decisions are not audited as actions: " + decision);
        }
        String correlationId = CorrelationContextHolder.get()
                .map(CorrelationContext::correlationId)
                .orElseGet(() -> UUID.randomUUID().toString());

        return new AuditEvent(
                UUID.randomUUID().toString(),
                action.value(),
                String.valueOf(action.crud()),
                action.resource().key(),
                decision.actorId(),
                decision.tenant().id(),
                clock.instant(),
                correlationId,
                producer,
                redactor.redact(metadata));
    }

    public AuditEvent fromDecision(AccessDecision decision, AuditAction action) {
        return fromDecision(decision, action, Map.of());
    }

    public String producer() {
        return producer;
    }
}
