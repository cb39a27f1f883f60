package com.mqol.teamservice;

import com.mqol.database.migration.FlywayMigrationConfig;
import com.mqol.teamservice.config.AuditProperties;
import com.mqol.teamservice.config.TeamServiceProperties;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Team service: teams, memberships, invitations and patients behind role-based access control.
 *
 * <p>Key features configured by default:
 *
 * <ul>
 *   <li>Every team-scoped endpoint goes through {@code TeamAccessGuard} before any business logic
 *   <li>Flyway migrates the team database on start-up
 *   <li>Correlation id propagation and RFC 7807 ProblemDetail errors
 *   <li>Actuator health, metrics and Prometheus endpoints; graceful shutdown
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties({TeamServiceProperties.class, AuditProperties.class})
@Import(FlywayMigrationConfig.class)
public class TeamServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(TeamServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TeamServiceApplication.class, args);
        log.info("Team service started");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
