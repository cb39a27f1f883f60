package com.mqol.database.migration;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized Flyway configuration.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * mqol:
 *   flyway:
 *     enabled: true
 *     locations: classpath:db/migration/mqol
 *     baseline-on-migrate: true
 * }</pre>
 *
 * @param enabled whether to migrate on start-up (default true)
 * @param locations Flyway migration locations
 * @param baselineOnMigrate baseline an existing schema that has no history table (default true)
 */
@Validated
@ConfigurationProperties(prefix = "mqol.flyway")
public record FlywayConfigProperties(
        Boolean enabled,
        @NotBlank String locations,
        Boolean baselineOnMigrate) {

    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/mqol";

    public FlywayConfigProperties {
        if (enabled == null) enabled = true;
        if (locations == null) locations = DEFAULT_LOCATIONS;
        if (baselineOnMigrate == null) baselineOnMigrate = true;
    }
}
