package com.mqol.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Migrates the application's {@link DataSource} with Flyway when the context starts.
 *
 * <p>Services using this module turn Spring Boot's own Flyway auto-configuration off so the schema
 * is migrated exactly once:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 *
 * <p>{@code clean} is always disabled; a misconfigured environment must never be able to drop the
 * team database.
 *
 * @see FlywayConfigProperties
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "mqol.flyway", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FlywayMigrationConfig {

    private static final Logger log = LoggerFactory.getLogger(FlywayMigrationConfig.class);

    /** Bean name for the team database Flyway instance. */
    public static final String FLYWAY_BEAN = "mqolFlyway";

    /**
     * @return configured Flyway instance, migrated through the bean's init method
     */
    @Bean(name = FLYWAY_BEAN, initMethod = "migrate")
    public Flyway mqolFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        log.info("Configuring Flyway: locations={} baselineOnMigrate={}",
                properties.locations(), properties.baselineOnMigrate());
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations())
                .baselineOnMigrate(properties.baselineOnMigrate())
                .cleanDisabled(true)
                .load();
    }
}
