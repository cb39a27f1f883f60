package com.mqol.teamservice.infrastructure.persistence;

import com.mqol.access.TeamScope;
import com.mqol.teamservice.domain.BaselineMeasurements;
import com.mqol.teamservice.domain.BaselinePage;
import com.mqol.teamservice.domain.BloodPressure;
import com.mqol.teamservice.domain.PatientBaseline;
import com.mqol.teamservice.domain.port.PatientBaselineRepository;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Repository;

/**
 * Patient baselines, always read and written through {@link TeamScopedJdbc}. Rows are addressed by
 * team, patient and id together, so a baseline id is only found through its own patient.
 */
@Repository
public class JdbcPatientBaselineRepository implements PatientBaselineRepository {

    private static final String COLUMNS = "id, team_id, patient_id, date_recorded, height, weight, "
            + "bp_systolic, bp_diastolic, heart_rate, temperature, oxygen_sat, blood_sugar, notes, "
            + "created_by, updated_by, created_at, updated_at";

    private static final String LIVE = "team_id = :teamId AND patient_id = :patientId AND deleted_at IS NULL";

    private final TeamScopedJdbc scoped;

    public JdbcPatientBaselineRepository(TeamScopedJdbc scoped) {
        this.scoped = scoped;
    }

    @Override
    public PatientBaseline insert(
            TeamScope scope, String id, String patientId, BaselineMeasurements measurements, Instant now) {
        Map<String, Object> params = measurementParams(measurements);
        params.put("id", id);
        params.put("patientId", patientId);
        params.put("createdBy", scope.actorId());
        params.put("now", Timestamps.toDb(now));
        scoped.update(scope, "INSERT INTO patient_baselines (id, team_id, patient_id, date_recorded, height, "
                + "weight, bp_systolic, bp_diastolic, heart_rate, temperature, oxygen_sat, blood_sugar, notes, "
                + "created_by, created_at, updated_at) "
                + "VALUES (:id, :teamId, :patientId, :dateRecorded, :height, :weight, :systolic, :diastolic, "
                + ":heartRate, :temperature, :oxygenSat, :bloodSugar, :notes, :createdBy, :now, :now)", params);
        return new PatientBaseline(id, scope.tenantId(), patientId, measurements, scope.actorId(), null, now, now);
    }

    @Override
    public Optional<PatientBaseline> find(TeamScope scope, String patientId, String baselineId) {
        return scoped.queryForOptional(scope,
                "SELECT " + COLUMNS + " FROM patient_baselines WHERE id = :id AND " + LIVE,
                Map.of("id", baselineId, "patientId", patientId), this::mapRow);
    }

    @Override
    public BaselinePage list(
            TeamScope scope, String patientId, Instant from, Instant to, int limit, int offset) {
        Map<String, Object> params = new HashMap<>();
        params.put("patientId", patientId);
        String filter = LIVE;
        if (from != null) {
            params.put("from", Timestamps.toDb(from));
            filter += " AND date_recorded >= :from";
        }
        if (to != null) {
            params.put("to", Timestamps.toDb(to));
            filter += " AND date_recorded <= :to";
        }
        Long total = scoped.queryForObject(scope, "SELECT COUNT(*) FROM patient_baselines WHERE " + filter,
                params, Long.class);

        params.put("limit", limit);
        params.put("offset", offset);
        List<PatientBaseline> data = scoped.query(scope,
                "SELECT " + COLUMNS + " FROM patient_baselines WHERE " + filter
                        + " ORDER BY date_recorded DESC, id LIMIT :limit OFFSET :offset",
                params, this::mapRow);
        return new BaselinePage(data, total == null ? 0 : total, limit, offset);
    }

    @Override
    public int update(
            TeamScope scope, String patientId, String baselineId, BaselineMeasurements measurements, Instant now) {
        Map<String, Object> params = measurementParams(measurements);
        params.put("id", baselineId);
        params.put("patientId", patientId);
        params.put("updatedBy", scope.actorId());
        params.put("now", Timestamps.toDb(now));
        return scoped.update(scope, "UPDATE patient_baselines SET date_recorded = :dateRecorded, "
                + "height = :height, weight = :weight, bp_systolic = :systolic, bp_diastolic = :diastolic, "
                + "heart_rate = :heartRate, temperature = :temperature, oxygen_sat = :oxygenSat, "
                + "blood_sugar = :bloodSugar, notes = :notes, updated_by = :updatedBy, updated_at = :now "
                + "WHERE id = :id AND " + LIVE, params);
    }

    @Override
    public int archive(TeamScope scope, String patientId, String baselineId, String reason, Instant now,
            Instant retentionUntil) {
        Map<String, Object> params = new HashMap<>();
        params.put("id", baselineId);
        params.put("patientId", patientId);
        params.put("deletedBy", scope.actorId());
        params.put("reason", reason);
        params.put("now", Timestamps.toDb(now));
        params.put("retentionUntil", Timestamps.toDb(retentionUntil));
        return scoped.update(scope, "UPDATE patient_baselines SET deleted_at = :now, deleted_by = :deletedBy, "
                + "deletion_reason = :reason, retention_until = :retentionUntil, updated_by = :deletedBy, "
                + "updated_at = :now WHERE id = :id AND " + LIVE, params);
    }

    private static Map<String, Object> measurementParams(BaselineMeasurements m) {
        Map<String, Object> params = new HashMap<>();
        params.put("dateRecorded", Timestamps.toDb(m.dateRecorded()));
        params.put("height", m.height());
        params.put("weight", m.weight());
        params.put("systolic", m.bloodPressure() == null ? null : m.bloodPressure().systolic());
        params.put("diastolic", m.bloodPressure() == null ? null : m.bloodPressure().diastolic());
        params.put("heartRate", m.heartRate());
        params.put("temperature", m.temperature());
        params.put("oxygenSat", m.oxygenSat());
        params.put("bloodSugar", m.bloodSugar());
        params.put("notes", m.notes());
        return params;
    }

    private PatientBaseline mapRow(ResultSet rs, int rowNum) throws SQLException {
        Integer systolic = rs.getObject("bp_systolic", Integer.class);
        Integer diastolic = rs.getObject("bp_diastolic", Integer.class);
        BaselineMeasurements measurements = new BaselineMeasurements(
                Timestamps.read(rs, "date_recorded"),
                rs.getObject("height", Double.class),
                rs.getObject("weight", Double.class),
                systolic == null || diastolic == null ? null : new BloodPressure(systolic, diastolic),
                rs.getObject("heart_rate", Integer.class),
                rs.getObject("temperature", Double.class),
                rs.getObject("oxygen_sat", Integer.class),
                rs.getObject("blood_sugar", Double.class),
                rs.getString("notes"));
        return new PatientBaseline(
                rs.getString("id"),
                rs.getString("team_id"),
                rs.getString("patient_id"),
                measurements,
                rs.getString("created_by"),
                rs.getString("updated_by"),
                Timestamps.read(rs, "created_at"),
                Timestamps.read(rs, "updated_at"));
    }
}
