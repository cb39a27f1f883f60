package com.mqol.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of the audit trail.
 * <p>
 * Events are created by {@link AuditEventFactory} from an allowed access decision, so
 * {@code actorId} and {@code tenantId} always name an actor who was a member of the tenant at
 * the time.
 */
public record AuditEvent(
        /** Unique identifier for this event (UUID v4). */
        String eventId,

        /** Canonical action name, see {@link AuditAction#value()}. */
        String action,

        /** CRUD letter: c, r, u or d. */
        String crud,

        /** Resource key, e.g. "team_patient". */
        String resource,

        String actorId,

        String tenantId,

        Instant occurredAt,

        /** Correlation id of the request that caused the event. */
        String correlationId,

        /** Name of the service that produced the event. */
        String producer,

        /** Action-specific details, already redacted. */
        Map<String, Object> metadata) {

    public AuditEvent {
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
