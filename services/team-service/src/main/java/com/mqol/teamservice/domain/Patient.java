package com.mqol.teamservice.domain;

import java.time.Instant;

/**
 * A patient record. Belongs to exactly one team; soft-deleted records are never returned.
 */
public record Patient(
        String id,
        String teamId,
        String firstName,
        String lastName,
        String mobile,
        String gender,
        String createdBy,
        String updatedBy,
        Instant createdAt,
        Instant updatedAt) {
}
