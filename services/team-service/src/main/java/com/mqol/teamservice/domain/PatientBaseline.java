package com.mqol.teamservice.domain;

import java.time.Instant;

/**
 * Baseline measurements of one patient. Lives in the patient's team; archived baselines are never
 * returned.
 */
public record PatientBaseline(
        String id,
        String teamId,
        String patientId,
        BaselineMeasurements measurements,
        String createdBy,
        String updatedBy,
        Instant createdAt,
        Instant updatedAt) {
}
