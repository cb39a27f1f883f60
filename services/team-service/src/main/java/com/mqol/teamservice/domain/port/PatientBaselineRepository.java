package com.mqol.teamservice.domain.port;

import com.mqol.access.TeamScope;
import com.mqol.teamservice.domain.BaselineMeasurements;
import com.mqol.teamservice.domain.BaselinePage;
import com.mqol.teamservice.domain.PatientBaseline;

import java.time.Instant;
import java.util.Optional;

/**
 * Patient baseline storage. Every method filters on the scope's team and the given patient, and
 * ignores archived rows.
 */
public interface PatientBaselineRepository {

    PatientBaseline insert(TeamScope scope, String id, String patientId, BaselineMeasurements measurements,
            Instant now);

    Optional<PatientBaseline> find(TeamScope scope, String patientId, String baselineId);

    /**
     * Newest recording first. {@code from} and {@code to} bound {@code date_recorded} inclusively
     * and may each be null.
     */
    BaselinePage list(TeamScope scope, String patientId, Instant from, Instant to, int limit, int offset);

    int update(TeamScope scope, String patientId, String baselineId, BaselineMeasurements measurements,
            Instant now);

    int archive(TeamScope scope, String patientId, String baselineId, String reason, Instant now,
            Instant retentionUntil);
}
