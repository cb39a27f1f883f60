package com.mqol.teamservice.infrastructure.persistence;

import com.mqol.access.Role;
import com.mqol.access.TeamScope;
import com.mqol.teamservice.domain.Invitation;
import com.mqol.teamservice.domain.port.InvitationRepository;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcInvitationRepository implements InvitationRepository {

    private static final String COLUMNS =
            "id, team_id, token, email, role, invited_by, expires_at, created_at";

    private final NamedParameterJdbcTemplate jdbc;
    private final TeamScopedJdbc scoped;

    public JdbcInvitationRepository(NamedParameterJdbcTemplate jdbc, TeamScopedJdbc scoped) {
        this.jdbc = jdbc;
        this.scoped = scoped;
    }

    @Override
    public Invitation insert(TeamScope scope, Invitation invitation) {
        Map<String, Object> params = new HashMap<>();
        params.put("id", invitation.id());
        params.put("token", invitation.token());
        params.put("email", invitation.email());
        params.put("role", invitation.role().value());
        params.put("invitedBy", invitation.invitedBy());
        params.put("expiresAt", Timestamps.toDb(invitation.expiresAt()));
        params.put("createdAt", Timestamps.toDb(invitation.createdAt()));
        scoped.update(scope, "INSERT INTO invitations (" + COLUMNS + ") "
                + "VALUES (:id, :teamId, :token, :email, :role, :invitedBy, :expiresAt, :createdAt)", params);
        return new Invitation(invitation.id(), scope.tenantId(), invitation.token(), invitation.email(),
                invitation.role(), invitation.invitedBy(), invitation.expiresAt(), invitation.createdAt());
    }

    @Override
    public List<Invitation> findAll(TeamScope scope) {
        return scoped.query(scope,
                "SELECT " + COLUMNS + " FROM invitations WHERE team_id = :teamId ORDER BY created_at DESC",
                Map.of(), this::mapRow);
    }

    @Override
    public int delete(TeamScope scope, String invitationId) {
        return scoped.update(scope, "DELETE FROM invitations WHERE team_id = :teamId AND id = :id",
                Map.of("id", invitationId));
    }

    @Override
    public Optional<Invitation> findByToken(String token) {
        return jdbc.query("SELECT " + COLUMNS + " FROM invitations WHERE token = :token",
                        Map.of("token", token), this::mapRow)
                .stream()
                .findFirst();
    }

    @Override
    public int deleteByToken(String token) {
        return jdbc.update("DELETE FROM invitations WHERE token = :token", Map.of("token", token));
    }

    private Invitation mapRow(ResultSet rs, int rowNum) throws SQLException {
        String role = rs.getString("role");
        return new Invitation(
                rs.getString("id"),
                rs.getString("team_id"),
                rs.getString("token"),
                rs.getString("email"),
                Role.fromString(role)
                        .orElseThrow(() -> new DataRetrievalFailureException("Unknown role in invitations: " + role)),
                rs.getString("invited_by"),
                Timestamps.read(rs, "expires_at"),
                Timestamps.read(rs, "created_at"));
    }
}
