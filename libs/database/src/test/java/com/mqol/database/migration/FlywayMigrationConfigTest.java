package com.mqol.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;

@DisplayName("FlywayMigrationConfig")
class FlywayMigrationConfigTest {

    private static DataSource h2() {
        return DataSourceBuilder.create()
                .url("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1")
                .username("sa")
                .password("")
                .build();
    }

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withBean(DataSource.class, FlywayMigrationConfigTest::h2)
            .withUserConfiguration(FlywayMigrationConfig.class);

    @Nested
    @DisplayName("properties")
    class Properties {

        @Test
        @DisplayName("applies defaults when nothing is configured")
        void defaults() {
            var properties = new FlywayConfigProperties(null, null, null);

            assertThat(properties.enabled()).isTrue();
            assertThat(properties.locations()).isEqualTo(FlywayConfigProperties.DEFAULT_LOCATIONS);
            assertThat(properties.baselineOnMigrate()).isTrue();
        }

        @Test
        @DisplayName("binds mqol.flyway.* from the environment")
        void binds() {
            runner.withPropertyValues("mqol.flyway.baseline-on-migrate=false")
                    .run(context -> assertThat(context.getBean(FlywayConfigProperties.class)
                            .baselineOnMigrate()).isFalse());
        }
    }

    @Nested
    @DisplayName("migration")
    class Migration {

        @Test
        @DisplayName("creates the schema on start-up")
        void migrates() {
            runner.run(context -> {
                assertThat(context).hasBean(FlywayMigrationConfig.FLYWAY_BEAN);
                JdbcTemplate jdbc = new JdbcTemplate(context.getBean(DataSource.class));

                Flyway flyway = context.getBean(Flyway.class);
                assertThat(flyway.info().applied()).hasSize(2);
                assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM patients", Integer.class))
                        .isZero();
                assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM patient_baselines", Integer.class))
                        .isZero();
            });
        }

        @Test
        @DisplayName("a baseline must belong to its patient's team")
        void baselineFollowsPatientTeam() {
            runner.run(context -> {
                JdbcTemplate jdbc = new JdbcTemplate(context.getBean(DataSource.class));
                for (String team : new String[] {"t1", "t2"}) {
                    jdbc.update("INSERT INTO teams (id, slug, name, created_at, updated_at) "
                            + "VALUES (?, ?, 'Clinic', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)", team, "slug-" + team);
                }
                jdbc.update("INSERT INTO patients (id, team_id, first_name, last_name, created_by, created_at, updated_at) "
                        + "VALUES ('p1', 't1', 'Ada', 'Lovelace', 'u1', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)");
                String insert = "INSERT INTO patient_baselines "
                        + "(id, team_id, patient_id, date_recorded, created_by, created_at, updated_at) "
                        + "VALUES (?, ?, 'p1', CURRENT_TIMESTAMP, 'u1', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)";

                jdbc.update(insert, "b1", "t1");
                assertThatThrownBy(() -> jdbc.update(insert, "b2", "t2"))
                        .isInstanceOf(DataIntegrityViolationException.class);
            });
        }

        @Test
        @DisplayName("rejects a second membership for the same team and user")
        void uniqueMembership() {
            runner.run(context -> {
                JdbcTemplate jdbc = new JdbcTemplate(context.getBean(DataSource.class));
                jdbc.update("INSERT INTO teams (id, slug, name, created_at, updated_at) "
                        + "VALUES ('t1', 'acme', 'Acme', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)");
                String insert = "INSERT INTO team_members (id, team_id, user_id, role, created_at, updated_at) "
                        + "VALUES (?, 't1', 'u1', 'member', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)";
                jdbc.update(insert, "m1");

                assertThatThrownBy(() -> jdbc.update(insert, "m2"))
                        .isInstanceOf(DataIntegrityViolationException.class);
            });
        }

        @Test
        @DisplayName("deleting a team cascades to its members")
        void cascade() {
            runner.run(context -> {
                JdbcTemplate jdbc = new JdbcTemplate(context.getBean(DataSource.class));
                jdbc.update("INSERT INTO teams (id, slug, name, created_at, updated_at) "
                        + "VALUES ('t1', 'acme', 'Acme', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)");
                jdbc.update("INSERT INTO team_members (id, team_id, user_id, role, created_at, updated_at) "
                        + "VALUES ('m1', 't1', 'u1', 'owner', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)");

                jdbc.update("DELETE FROM teams WHERE id = 't1'");

                assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM team_members", Integer.class))
                        .isZero();
            });
        }

        @Test
        @DisplayName("is skipped when mqol.flyway.enabled=false")
        void disabled() {
            runner.withPropertyValues("mqol.flyway.enabled=false")
                    .run(context -> assertThat(context).doesNotHaveBean(Flyway.class));
        }
    }
}
