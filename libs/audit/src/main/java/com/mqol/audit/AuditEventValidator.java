package com.mqol.audit;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Checks that an {@link AuditEvent} carries everything the audit trail needs. All errors are
 * returned at once.
 */
public final class AuditEventValidator {

    private static final Set<String> CRUD_LETTERS = Set.of("c", "r", "u", "d");

    private AuditEventValidator() {
        // utility class
    }

    public static ValidationResult validate(AuditEvent event) {
        if (event == null) {
            return ValidationResult.fail(List.of("event must not be null"));
        }
        List<String> errors = new ArrayList<>();

        if (isBlank(event.eventId())) {
            errors.add("eventId must not be null or blank");
        }
        if (isBlank(event.action())) {
            errors.add("action must not be null or blank");
        } else if (!AuditAction.isKnown(event.action())) {
            errors.add("action '%s' is not a known audit action".formatted(event.action()));
        }
        if (event.crud() == null || !CRUD_LETTERS.contains(event.crud())) {
            errors.add("crud must be one of c, r, u, d");
        }
        if (isBlank(event.resource())) {
            errors.add("resource must not be null or blank");
        }
        if (isBlank(event.actorId())) {
            errors.add("actorId must not be null or blank");
        }
        if (isBlank(event.tenantId())) {
            errors.add("tenantId must not be null or blank");
        }
        if (event.occurredAt() == null) {
            errors.add("occurredAt must not be null");
        }
        if (isBlank(event.producer())) {
            errors.add("producer must not be null or blank");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
