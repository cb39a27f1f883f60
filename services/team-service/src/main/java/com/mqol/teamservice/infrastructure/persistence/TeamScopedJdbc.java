package com.mqol.teamservice.infrastructure.persistence;

import com.mqol.access.TeamScope;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * {@link NamedParameterJdbcTemplate} wrapper for team-scoped tables.
 *
 * <p>The {@code :teamId} parameter is always bound from the {@link TeamScope}. Statements that do
 * not reference {@code :teamId}, or callers that try to supply it themselves, are rejected with
 * {@link InvalidDataAccessApiUsageException} before reaching the database.
 */
@Component
public class TeamScopedJdbc {

    public static final String TEAM_ID = "teamId";

    private static final String PLACEHOLDER = ":" + TEAM_ID;

    private final NamedParameterJdbcTemplate jdbc;

    public TeamScopedJdbc(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public <T> List<T> query(TeamScope scope, String sql, Map<String, ?> params, RowMapper<T> mapper) {
        return jdbc.query(sql, bind(scope, sql, params), mapper);
    }

    public <T> Optional<T> queryForOptional(
            TeamScope scope, String sql, Map<String, ?> params, RowMapper<T> mapper) {
        return query(scope, sql, params, mapper).stream().findFirst();
    }

    public <T> T queryForObject(TeamScope scope, String sql, Map<String, ?> params, Class<T> type) {
        return jdbc.queryForObject(sql, bind(scope, sql, params), type);
    }

    /** @return rows affected */
    public int update(TeamScope scope, String sql, Map<String, ?> params) {
        return jdbc.update(sql, bind(scope, sql, params));
    }

    private static MapSqlParameterSource bind(TeamScope scope, String sql, Map<String, ?> params) {
        if (scope == null) {
            throw new InvalidDataAccessApiUsageException("Team-scoped SQL needs a scope");
        }
        if (!sql.contains(PLACEHOLDER)) {
            throw new InvalidDataAccessApiUsageException("Team-scoped SQL must filter on " + PLACEHOLDER + ": " + sql);
        }
        if (params.containsKey(TEAM_ID)) {
            throw new InvalidDataAccessApiUsageException(TEAM_ID + " is bound from the scope, not from parameters");
        }
        return new MapSqlParameterSource(params).addValue(TEAM_ID, scope.tenantId());
    }
}
