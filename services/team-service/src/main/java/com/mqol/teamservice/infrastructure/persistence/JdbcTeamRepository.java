package com.mqol.teamservice.infrastructure.persistence;

import com.mqol.access.Role;
import com.mqol.access.TeamScope;
import com.mqol.access.Tenant;
import com.mqol.teamservice.domain.ConflictException;
import com.mqol.teamservice.domain.Team;
import com.mqol.teamservice.domain.TeamMembershipView;
import com.mqol.teamservice.domain.port.TeamRepository;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcTeamRepository implements TeamRepository {

    private static final String SELECT_TEAM =
            "SELECT id, slug, name, created_at, updated_at FROM teams";

    private final NamedParameterJdbcTemplate jdbc;
    private final TeamScopedJdbc scoped;

    public JdbcTeamRepository(NamedParameterJdbcTemplate jdbc, TeamScopedJdbc scoped) {
        this.jdbc = jdbc;
        this.scoped = scoped;
    }

    @Override
    public Team insert(Team team) {
        try {
            jdbc.update("INSERT INTO teams (id, slug, name, created_at, updated_at) "
                            + "VALUES (:id, :slug, :name, :createdAt, :updatedAt)",
                    Map.of("id", team.id(),
                            "slug", team.slug(),
                            "name", team.name(),
                            "createdAt", Timestamps.toDb(team.createdAt()),
                            "updatedAt", Timestamps.toDb(team.updatedAt())));
        } catch (DuplicateKeyException e) {
            throw new ConflictException("Team slug '%s' is already taken".formatted(team.slug()), e);
        }
        team.features().forEach((feature, enabled) -> jdbc.update(
                "INSERT INTO team_features (team_id, feature, enabled) VALUES (:teamId, :feature, :enabled)",
                Map.of("teamId", team.id(), "feature", feature, "enabled", enabled)));
        return team;
    }

    @Override
    public Optional<Tenant> findById(String tenantId) {
        return findOne(SELECT_TEAM + " WHERE id = :value", tenantId).map(Team::toTenant);
    }

    @Override
    public Optional<Tenant> findBySlug(String slug) {
        return findOne(SELECT_TEAM + " WHERE slug = :value", slug).map(Team::toTenant);
    }

    @Override
    public Optional<Team> find(TeamScope scope) {
        return scoped.queryForOptional(scope, SELECT_TEAM + " WHERE id = :teamId", Map.of(), this::mapRow)
                .map(team -> withFeatures(team, features(team.id())));
    }

    @Override
    public List<TeamMembershipView> findAllForUser(String userId) {
        List<TeamMembershipView> views = jdbc.query(
                "SELECT t.id, t.slug, t.name, t.created_at, t.updated_at, m.role FROM teams t "
                        + "JOIN team_members m ON m.team_id = t.id "
                        + "WHERE m.user_id = :userId ORDER BY t.name",
                Map.of("userId", userId),
                (rs, n) -> new TeamMembershipView(mapRow(rs, n),
                        Role.fromString(rs.getString("role")).orElseThrow()));
        List<TeamMembershipView> result = new ArrayList<>(views.size());
        for (TeamMembershipView view : views) {
            result.add(new TeamMembershipView(withFeatures(view.team(), features(view.team().id())), view.role()));
        }
        return result;
    }

    @Override
    public void update(TeamScope scope, String name, Map<String, Boolean> features) {
        if (name != null) {
            scoped.update(scope, "UPDATE teams SET name = :name, updated_at = :now WHERE id = :teamId",
                    Map.of("name", name, "now", Timestamps.toDb(Instant.now())));
        }
        if (features != null) {
            features.forEach((feature, enabled) -> {
                Map<String, Object> params = Map.of("feature", feature, "enabled", enabled);
                int updated = scoped.update(scope,
                        "UPDATE team_features SET enabled = :enabled WHERE team_id = :teamId AND feature = :feature",
                        params);
                if (updated == 0) {
                    scoped.update(scope,
                            "INSERT INTO team_features (team_id, feature, enabled) VALUES (:teamId, :feature, :enabled)",
                            params);
                }
            });
            scoped.update(scope, "UPDATE teams SET updated_at = :now WHERE id = :teamId",
                    Map.of("now", Timestamps.toDb(Instant.now())));
        }
    }

    @Override
    public void delete(TeamScope scope) {
        scoped.update(scope, "DELETE FROM teams WHERE id = :teamId", Map.of());
    }

    private Optional<Team> findOne(String sql, String value) {
        return jdbc.query(sql, Map.of("value", value), this::mapRow).stream()
                .findFirst()
                .map(team -> withFeatures(team, features(team.id())));
    }

    private Map<String, Boolean> features(String teamId) {
        Map<String, Boolean> features = new LinkedHashMap<>();
        jdbc.query("SELECT feature, enabled FROM team_features WHERE team_id = :teamId ORDER BY feature",
                Map.of("teamId", teamId),
                rs -> {
                    features.put(rs.getString("feature"), rs.getBoolean("enabled"));
                });
        return features;
    }

    private static Team withFeatures(Team team, Map<String, Boolean> features) {
        return new Team(team.id(), team.slug(), team.name(), new HashMap<>(features),
                team.createdAt(), team.updatedAt());
    }

    private Team mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Team(
                rs.getString("id"),
                rs.getString("slug"),
                rs.getString("name"),
                Map.of(),
                Timestamps.read(rs, "created_at"),
                Timestamps.read(rs, "updated_at"));
    }
}
