package com.mqol.teamservice.infrastructure.persistence;

import com.mqol.access.Membership;
import com.mqol.access.Role;
import com.mqol.access.TeamScope;
import com.mqol.teamservice.domain.ConflictException;
import com.mqol.teamservice.domain.Member;
import com.mqol.teamservice.domain.port.MembershipRepository;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Memberships in {@code team_members}.
 *
 * <p>Role changes and removals are single statements that carry the last-owner guard. The guard
 * reads the other owners from the statement's snapshot, so callers take {@link #lockOwners} in the
 * same transaction first; without it, two transactions demoting two different owners could both
 * commit.
 */
@Repository
public class JdbcMembershipRepository implements MembershipRepository {

    private static final String OTHER_OWNERS_EXIST =
            "(SELECT COUNT(*) FROM team_members o WHERE o.team_id = :teamId AND o.role = 'owner' "
                    + "AND o.user_id <> :userId) > 0";

    private final NamedParameterJdbcTemplate jdbc;
    private final TeamScopedJdbc scoped;

    public JdbcMembershipRepository(NamedParameterJdbcTemplate jdbc, TeamScopedJdbc scoped) {
        this.jdbc = jdbc;
        this.scoped = scoped;
    }

    @Override
    public Optional<Membership> find(String tenantId, String actorId) {
        return jdbc.query(
                        "SELECT role FROM team_members WHERE team_id = :teamId AND user_id = :userId",
                        Map.of("teamId", tenantId, "userId", actorId),
                        (rs, n) -> new Membership(actorId, tenantId, role(rs)))
                .stream()
                .findFirst();
    }

    @Override
    public void insert(String teamId, String userId, Role role) {
        Instant now = Instant.now();
        try {
            jdbc.update("INSERT INTO team_members (id, team_id, user_id, role, created_at, updated_at) "
                            + "VALUES (:id, :teamId, :userId, :role, :now, :now)",
                    Map.of("id", UUID.randomUUID().toString(),
                            "teamId", teamId,
                            "userId", userId,
                            "role", role.value(),
                            "now", Timestamps.toDb(now)));
        } catch (DuplicateKeyException e) {
            throw new ConflictException("User is already a member of this team", e);
        }
    }

    @Override
    public List<Member> findAll(TeamScope scope) {
        return scoped.query(scope,
                "SELECT user_id, role, created_at, updated_at FROM team_members "
                        + "WHERE team_id = :teamId ORDER BY created_at, user_id",
                Map.of(), this::mapMember);
    }

    @Override
    public Optional<Member> find(TeamScope scope, String userId) {
        return scoped.queryForOptional(scope,
                "SELECT user_id, role, created_at, updated_at FROM team_members "
                        + "WHERE team_id = :teamId AND user_id = :userId",
                Map.of("userId", userId), this::mapMember);
    }

    @Override
    public List<String> lockOwners(TeamScope scope) {
        return scoped.query(scope,
                "SELECT user_id FROM team_members WHERE team_id = :teamId AND role = 'owner' "
                        + "ORDER BY user_id FOR UPDATE",
                Map.of(), (rs, n) -> rs.getString("user_id"));
    }

    @Override
    public int updateRole(TeamScope scope, String userId, Role role) {
        String sql = "UPDATE team_members SET role = :role, updated_at = :now "
                + "WHERE team_id = :teamId AND user_id = :userId";
        if (role != Role.OWNER) {
            // demoting an owner needs another owner left behind
            sql += " AND (role <> 'owner' OR " + OTHER_OWNERS_EXIST + ")";
        }
        return scoped.update(scope, sql,
                Map.of("role", role.value(), "userId", userId, "now", Timestamps.toDb(Instant.now())));
    }

    @Override
    public int delete(TeamScope scope, String userId) {
        return scoped.update(scope,
                "DELETE FROM team_members WHERE team_id = :teamId AND user_id = :userId "
                        + "AND (role <> 'owner' OR " + OTHER_OWNERS_EXIST + ")",
                Map.of("userId", userId));
    }

    private Member mapMember(ResultSet rs, int rowNum) throws SQLException {
        return new Member(
                rs.getString("user_id"),
                role(rs),
                Timestamps.read(rs, "created_at"),
                Timestamps.read(rs, "updated_at"));
    }

    private static Role role(ResultSet rs) throws SQLException {
        String value = rs.getString("role");
        return Role.fromString(value)
                .orElseThrow(() -> new DataRetrievalFailureException("Unknown role in team_members: " + value));
    }
}
