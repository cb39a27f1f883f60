package com.mqol.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Optional;

/**
 * JSON form of {@link AuditEvent}, one event per line in the audit log.
 * <p>
 * {@code occurredAt} is written as an ISO-8601 string.
 */
public final class AuditEventSerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private AuditEventSerializer() {
        // utility class
    }

    /**
     * @throws AuditSerializationException if serialization fails
     */
    public static String serialize(AuditEvent event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to serialize audit event: " + event.eventId(), e);
        }
    }

    /**
     * @throws AuditSerializationException if the JSON is malformed
     */
    public static AuditEvent deserialize(String json) {
        try {
            return MAPPER.readValue(json, AuditEvent.class);
        } catch (JsonProcessingException e) {
            throw new AuditSerializationException("Failed to deserialize audit event", e);
        }
    }

    public static Optional<AuditEvent> tryDeserialize(String json) {
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(deserialize(json));
        } catch (AuditSerializationException e) {
            return Optional.empty();
        }
    }

    public static class AuditSerializationException extends RuntimeException {
        public AuditSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
