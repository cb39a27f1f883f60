package com.mqol.teamservice.domain.service;

import com.mqol.access.AccessDecision;
import com.mqol.access.TeamScope;
import com.mqol.audit.AuditAction;
import com.mqol.observability.MetricFactory;
import com.mqol.teamservice.config.TeamServiceProperties;
import com.mqol.teamservice.domain.FeatureDisabledException;
import com.mqol.teamservice.domain.Patient;
import com.mqol.teamservice.domain.PatientDetails;
import com.mqol.teamservice.domain.PatientPage;
import com.mqol.teamservice.domain.RecordNotFoundException;
import com.mqol.teamservice.domain.port.PatientRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Service;

/**
 * Team-scoped patient records with soft deletion.
 *
 * <p>Every method first checks that patients are enabled for the deployment and for the team
 * (feature flag {@value #FEATURE}); a disabled feature looks like a missing endpoint.
 */
@Service
public class PatientService {

    public static final String FEATURE = "patients";
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;
    public static final String DEFAULT_DELETION_REASON = "Patient record soft deleted";

    private final PatientRepository patients;
    private final AuditTrail audit;
    private final MetricFactory metrics;
    private final TeamServiceProperties properties;
    private final Clock clock;

    public PatientService(
            PatientRepository patients,
            AuditTrail audit,
            MetricFactory metrics,
            TeamServiceProperties properties,
            Clock clock) {
        this.patients = patients;
        this.audit = audit;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param limit page size, {@value #DEFAULT_LIMIT} when null, at most {@value #MAX_LIMIT}
     * @param offset rows to skip, 0 when null
     */
    public PatientPage list(AccessDecision decision, String search, Integer limit, Integer offset) {
        TeamScope scope = enabledScope(decision);
        return patients.search(scope, search, resolveLimit(limit), resolveOffset(offset));
    }

    public Patient create(AccessDecision decision, PatientDetails details) {
        TeamScope scope = enabledScope(decision);
        Patient patient = patients.insert(scope, UUID.randomUUID().toString(), details, clock.instant());
        metrics.increment("patient.created");
        audit.record(decision, AuditAction.PATIENT_CREATE, Map.of("patientId", patient.id()));
        return patient;
    }

    public Patient get(AccessDecision decision, String patientId) {
        Patient patient = existing(enabledScope(decision), patientId);
        metrics.increment("patient.fetched");
        audit.record(decision, AuditAction.PATIENT_VIEW, Map.of("patientId", patientId));
        return patient;
    }

    public Patient update(AccessDecision decision, String patientId, PatientDetails details) {
        TeamScope scope = enabledScope(decision);
        if (patients.update(scope, patientId, details, clock.instant()) == 0) {
            throw new RecordNotFoundException("Patient");
        }
        metrics.increment("patient.updated");
        audit.record(decision, AuditAction.PATIENT_UPDATE, Map.of("patientId", patientId));
        return existing(scope, patientId);
    }

    /**
     * Marks the record deleted and keeps it until the retention period ends.
     */
    public void softDelete(AccessDecision decision, String patientId, String reason) {
        TeamScope scope = enabledScope(decision);
        String resolvedReason = reason == null || reason.isBlank() ? DEFAULT_DELETION_REASON : reason.strip();
        Instant now = clock.instant();
        if (patients.softDelete(scope, patientId, resolvedReason, now, now.plus(properties.patientRetention())) == 0) {
            throw new RecordNotFoundException("Patient");
        }
        metrics.increment("patient.removed");
        audit.record(decision, AuditAction.PATIENT_SOFT_DELETE,
                Map.of("patientId", patientId, "deletionReason", resolvedReason));
    }

    private TeamScope enabledScope(AccessDecision decision) {
        return enabledScope(properties, decision);
    }

    /**
     * The decision's scope, provided patients are enabled for the deployment and the team. Patient
     * baselines sit behind the same switch.
     *
     * @throws FeatureDisabledException otherwise
     */
    static TeamScope enabledScope(TeamServiceProperties properties, AccessDecision decision) {
        if (!properties.patientsEnabled() || !decision.tenant().featureEnabled(FEATURE, true)) {
            throw new FeatureDisabledException(FEATURE);
        }
        return decision.scope();
    }

    static int resolveLimit(Integer limit) {
        int resolved = limit == null ? DEFAULT_LIMIT : limit;
        if (resolved < 1 || resolved > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return resolved;
    }

    static int resolveOffset(Integer offset) {
        int resolved = offset == null ? 0 : offset;
        if (resolved < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        return resolved;
    }

    private Patient existing(TeamScope scope, String patientId) {
        return patients.find(scope, patientId).orElseThrow(() -> new RecordNotFoundException("Patient"));
    }
}
