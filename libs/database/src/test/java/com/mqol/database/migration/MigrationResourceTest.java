package com.mqol.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Checks that the migration SQL is packaged where Flyway looks for it.
 */
@DisplayName("Migration SQL resources")
class MigrationResourceTest {

    private static final String INITIAL_SCHEMA = "db/migration/mqol/V1__initial_schema.sql";
    private static final String PATIENT_BASELINES = "db/migration/mqol/V2__patient_baselines.sql";

    @Test
    @DisplayName("V1__initial_schema.sql is on the classpath")
    void initialSchemaOnClasspath() throws IOException {
        assertThat(read(INITIAL_SCHEMA)).isNotBlank();
    }

    @Test
    @DisplayName("every team-scoped table has a cascading team_id")
    void teamScopedTablesCascade() throws IOException {
        String sql = read(INITIAL_SCHEMA);

        for (String table : new String[] {"team_features", "team_members", "invitations", "patients"}) {
            String body = sql.substring(sql.indexOf("CREATE TABLE " + table));
            body = body.substring(0, body.indexOf(");"));
            assertThat(body)
                    .as("%s must reference teams with ON DELETE CASCADE", table)
                    .contains("team_id")
                    .contains("NOT NULL REFERENCES teams (id) ON DELETE CASCADE");
        }
    }

    @Test
    @DisplayName("patient baselines cascade from their team and their patient")
    void baselinesCascade() throws IOException {
        assertThat(read(PATIENT_BASELINES))
                .contains("NOT NULL REFERENCES teams (id) ON DELETE CASCADE")
                .contains("FOREIGN KEY (patient_id, team_id)")
                .contains("REFERENCES patients (id, team_id) ON DELETE CASCADE");
    }

    @Test
    @DisplayName("membership is unique per team and user")
    void membershipUnique() throws IOException {
        assertThat(read(INITIAL_SCHEMA)).contains("UNIQUE (team_id, user_id)");
    }

    private String read(String path) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            assertThat(is).as("Resource '%s' must be on the classpath", path).isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
