package com.mqol.teamservice.infrastructure.persistence;

import com.mqol.access.TeamScope;
import com.mqol.teamservice.domain.Patient;
import com.mqol.teamservice.domain.PatientDetails;
import com.mqol.teamservice.domain.PatientPage;
import com.mqol.teamservice.domain.port.PatientRepository;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Repository;

/**
 * Patients, always read and written through {@link TeamScopedJdbc}.
 */
@Repository
public class JdbcPatientRepository implements PatientRepository {

    private static final String COLUMNS = "id, team_id, first_name, last_name, mobile, gender, "
            + "created_by, updated_by, created_at, updated_at";

    private static final String LIVE = "team_id = :teamId AND deleted_at IS NULL";

    private static final String SEARCH = " AND (LOWER(first_name) LIKE :search "
            + "OR LOWER(last_name) LIKE :search OR LOWER(mobile) LIKE :search)";

    private final TeamScopedJdbc scoped;

    public JdbcPatientRepository(TeamScopedJdbc scoped) {
        this.scoped = scoped;
    }

    @Override
    public Patient insert(TeamScope scope, String id, PatientDetails details, Instant now) {
        Map<String, Object> params = detailParams(details);
        params.put("id", id);
        params.put("createdBy", scope.actorId());
        params.put("now", Timestamps.toDb(now));
        scoped.update(scope, "INSERT INTO patients (id, team_id, first_name, last_name, mobile, gender, "
                + "created_by, created_at, updated_at) "
                + "VALUES (:id, :teamId, :firstName, :lastName, :mobile, :gender, :createdBy, :now, :now)", params);
        return new Patient(id, scope.tenantId(), details.firstName(), details.lastName(), details.mobile(),
                details.gender(), scope.actorId(), null, now, now);
    }

    @Override
    public Optional<Patient> find(TeamScope scope, String patientId) {
        return scoped.queryForOptional(scope,
                "SELECT " + COLUMNS + " FROM patients WHERE id = :id AND " + LIVE,
                Map.of("id", patientId), this::mapRow);
    }

    @Override
    public PatientPage search(TeamScope scope, String search, int limit, int offset) {
        Map<String, Object> params = new HashMap<>();
        String filter = LIVE;
        if (search != null && !search.isBlank()) {
            params.put("search", "%" + escapeLike(search.strip().toLowerCase(Locale.ROOT)) + "%");
            filter += SEARCH;
        }
        Long total = scoped.queryForObject(scope, "SELECT COUNT(*) FROM patients WHERE " + filter,
                params, Long.class);

        params.put("limit", limit);
        params.put("offset", offset);
        List<Patient> data = scoped.query(scope,
                "SELECT " + COLUMNS + " FROM patients WHERE " + filter
                        + " ORDER BY created_at DESC, id LIMIT :limit OFFSET :offset",
                params, this::mapRow);
        return new PatientPage(data, total == null ? 0 : total, limit, offset);
    }

    @Override
    public int update(TeamScope scope, String patientId, PatientDetails details, Instant now) {
        Map<String, Object> params = detailParams(details);
        params.put("id", patientId);
        params.put("updatedBy", scope.actorId());
        params.put("now", Timestamps.toDb(now));
        return scoped.update(scope, "UPDATE patients SET first_name = :firstName, last_name = :lastName, "
                + "mobile = :mobile, gender = :gender, updated_by = :updatedBy, updated_at = :now "
                + "WHERE id = :id AND " + LIVE, params);
    }

    @Override
    public int softDelete(TeamScope scope, String patientId, String reason, Instant now, Instant retentionUntil) {
        Map<String, Object> params = new HashMap<>();
        params.put("id", patientId);
        params.put("deletedBy", scope.actorId());
        params.put("reason", reason);
        params.put("now", Timestamps.toDb(now));
        params.put("retentionUntil", Timestamps.toDb(retentionUntil));
        return scoped.update(scope, "UPDATE patients SET deleted_at = :now, deleted_by = :deletedBy, "
                + "deletion_reason = :reason, retention_until = :retentionUntil, updated_at = :now "
                + "WHERE id = :id AND " + LIVE, params);
    }

    private static Map<String, Object> detailParams(PatientDetails details) {
        Map<String, Object> params = new HashMap<>();
        params.put("firstName", details.firstName());
        params.put("lastName", details.lastName());
        params.put("mobile", details.mobile());
        params.put("gender", details.gender());
        return params;
    }

    // LIKE wildcards in user input are matched literally
    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private Patient mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Patient(
                rs.getString("id"),
                rs.getString("team_id"),
                rs.getString("first_name"),
                rs.getString("last_name"),
                rs.getString("mobile"),
                rs.getString("gender"),
                rs.getString("created_by"),
                rs.getString("updated_by"),
                Timestamps.read(rs, "created_at"),
                Timestamps.read(rs, "updated_at"));
    }
}
