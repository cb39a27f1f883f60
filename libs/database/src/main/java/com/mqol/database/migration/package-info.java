/**
 * Flyway migration support for the team database.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.mqol.database.migration.FlywayConfigProperties}: externalized Flyway settings
 *       ({@code mqol.flyway.*})
 *   <li>{@link com.mqol.database.migration.FlywayMigrationConfig}: Spring {@code @Configuration}
 *       that migrates the application's {@code DataSource} on start-up
 * </ul>
 *
 * <p>Migrations live under {@code classpath:db/migration/mqol} and must run unchanged on
 * PostgreSQL and on H2 in PostgreSQL mode.
 */
package com.mqol.database.migration;
