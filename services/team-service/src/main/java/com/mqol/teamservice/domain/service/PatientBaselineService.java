package com.mqol.teamservice.domain.service;

import com.mqol.access.AccessDecision;
import com.mqol.access.TeamScope;
import com.mqol.audit.AuditAction;
import com.mqol.observability.MetricFactory;
import com.mqol.teamservice.config.TeamServiceProperties;
import com.mqol.teamservice.domain.BaselineMeasurements;
import com.mqol.teamservice.domain.BaselinePage;
import com.mqol.teamservice.domain.PatientBaseline;
import com.mqol.teamservice.domain.RecordNotFoundException;
import com.mqol.teamservice.domain.port.PatientBaselineRepository;
import com.mqol.teamservice.domain.port.PatientRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Service;

/**
 * Baseline measurements of a team's patients.
 *
 * <p>A baseline is reached only through a live patient of the caller's team: the patient is looked
 * up in the scope first, then the baseline is addressed by team, patient and id together. A patient
 * or baseline of another team is reported as not found. Baselines share the patients feature
 * switch.
 */
@Service
public class PatientBaselineService {

    public static final String DEFAULT_ARCHIVE_REASON = "Patient baseline archived";

    private final PatientBaselineRepository baselines;
    private final PatientRepository patients;
    private final AuditTrail audit;
    private final MetricFactory metrics;
    private final TeamServiceProperties properties;
    private final Clock clock;

    public PatientBaselineService(
            PatientBaselineRepository baselines,
            PatientRepository patients,
            AuditTrail audit,
            MetricFactory metrics,
            TeamServiceProperties properties,
            Clock clock) {
        this.baselines = baselines;
        this.patients = patients;
        this.audit = audit;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param from earliest {@code dateRecorded}, inclusive; null for no lower bound
     * @param to latest {@code dateRecorded}, inclusive; null for no upper bound
     */
    public BaselinePage list(
            AccessDecision decision, String patientId, Instant from, Instant to, Integer limit, Integer offset) {
        TeamScope scope = patientScope(decision, patientId);
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        BaselinePage page = baselines.list(scope, patientId, from, to,
                PatientService.resolveLimit(limit), PatientService.resolveOffset(offset));
        metrics.increment("patient_baseline.fetched");
        return page;
    }

    public PatientBaseline create(AccessDecision decision, String patientId, BaselineMeasurements measurements) {
        TeamScope scope = patientScope(decision, patientId);
        PatientBaseline baseline = baselines.insert(scope, UUID.randomUUID().toString(), patientId,
                measurements, clock.instant());
        metrics.increment("patient_baseline.created");
        audit.record(decision, AuditAction.PATIENT_BASELINE_CREATE,
                Map.of("patientId", patientId, "baselineId", baseline.id()));
        return baseline;
    }

    public PatientBaseline get(AccessDecision decision, String patientId, String baselineId) {
        PatientBaseline baseline = existing(patientScope(decision, patientId), patientId, baselineId);
        metrics.increment("patient_baseline.fetched");
        audit.record(decision, AuditAction.PATIENT_BASELINE_VIEW,
                Map.of("patientId", patientId, "baselineId", baselineId));
        return baseline;
    }

    /**
     * Replaces every measurement of the baseline.
     */
    public PatientBaseline update(
            AccessDecision decision, String patientId, String baselineId, BaselineMeasurements measurements) {
        TeamScope scope = patientScope(decision, patientId);
        if (baselines.update(scope, patientId, baselineId, measurements, clock.instant()) == 0) {
            throw new RecordNotFoundException("Baseline");
        }
        metrics.increment("patient_baseline.updated");
        audit.record(decision, AuditAction.PATIENT_BASELINE_UPDATE,
                Map.of("patientId", patientId, "baselineId", baselineId));
        return existing(scope, patientId, baselineId);
    }

    /**
     * Soft deletes the baseline and keeps it until the patient retention period ends.
     */
    public void archive(AccessDecision decision, String patientId, String baselineId, String reason) {
        TeamScope scope = patientScope(decision, patientId);
        String resolvedReason = reason == null || reason.isBlank() ? DEFAULT_ARCHIVE_REASON : reason.strip();
        Instant now = clock.instant();
        if (baselines.archive(scope, patientId, baselineId, resolvedReason, now,
                now.plus(properties.patientRetention())) == 0) {
            throw new RecordNotFoundException("Baseline");
        }
        metrics.increment("patient_baseline.archived");
        audit.record(decision, AuditAction.PATIENT_BASELINE_ARCHIVE,
                Map.of("patientId", patientId, "baselineId", baselineId, "deletionReason", resolvedReason));
    }

    private TeamScope patientScope(AccessDecision decision, String patientId) {
        TeamScope scope = PatientService.enabledScope(properties, decision);
        if (patients.find(scope, patientId).isEmpty()) {
            throw new RecordNotFoundException("Patient");
        }
        return scope;
    }

    private PatientBaseline existing(TeamScope scope, String patientId, String baselineId) {
        return baselines.find(scope, patientId, baselineId)
                .orElseThrow(() -> new RecordNotFoundException("Baseline"));
    }
}
