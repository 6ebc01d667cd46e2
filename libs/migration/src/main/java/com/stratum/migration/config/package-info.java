/**
 * Spring Boot auto-configuration for the migration engine.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.stratum.migration.config.MigrationProperties}: externalized configuration under
 *       {@code stratum.migration}
 *   <li>{@link com.stratum.migration.config.MigrationAutoConfiguration}: builds the {@link
 *       com.stratum.migration.MigrationService} and telemetry beans
 *   <li>{@link com.stratum.migration.config.MigrationStartupInitializer}: startup hook that applies
 *       pending migrations
 *   <li>{@link com.stratum.migration.config.IntegrityHealthIndicator}: actuator health contributor
 * </ul>
 */
package com.stratum.migration.config;
