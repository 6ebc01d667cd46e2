package com.stratum.migration.config;

import com.stratum.migration.MigrationSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized configuration for the migration engine.
 *
 * <p>WHY: Spring Boot binds YAML/env properties to this record at startup and validates them via
 * Bean Validation, so a missing JDBC URL or a ledger table name that is not a plain identifier
 * fails the context instead of the first migration.
 *
 * <pre>{@code
 * stratum:
 *   migration:
 *     enabled: true
 *     url: jdbc:postgresql://localhost:5432/stratum
 *     username: stratum
 *     password: stratum_dev_password
 *     directory: migrations
 *     ledger-table: schema_migrations
 *     run-on-startup: false
 *     lock:
 *       enabled: true
 *       lease: 10m
 * }</pre>
 *
 * @param enabled whether the auto-configuration creates any beans
 * @param url JDBC URL of the target datastore. Required.
 * @param username datastore user
 * @param password datastore password
 * @param directory directory holding the forward scripts (default {@code migrations})
 * @param ledgerTable ledger table name (default {@code schema_migrations})
 * @param runOnStartup apply pending migrations while the application context starts
 * @param lock lease lock around mutating commands
 */
@Validated
@ConfigurationProperties(prefix = "stratum.migration")
public record MigrationProperties(
        boolean enabled,
        @NotBlank String url,
        String username,
        String password,
        String directory,
        @Pattern(regexp = "[A-Za-z_][A-Za-z0-9_]{0,57}") String ledgerTable,
        boolean runOnStartup,
        @Valid Lock lock) {

    public static final String PREFIX = "stratum.migration";

    public static final String DEFAULT_DIRECTORY = "migrations";

    /**
     * Compact constructor: applies defaults for optional fields. Runs BEFORE Bean Validation, so
     * defaults satisfy constraints.
     */
    public MigrationProperties {
        if (directory == null || directory.isBlank()) {
            directory = DEFAULT_DIRECTORY;
        }
        if (ledgerTable == null || ledgerTable.isBlank()) {
            ledgerTable = MigrationSettings.DEFAULT_LEDGER_TABLE;
        }
        if (lock == null) {
            lock = new Lock(true, MigrationSettings.DEFAULT_LOCK_LEASE);
        }
    }

    /**
     * @param enabled whether {@code up}, {@code down} and {@code reset} take the lease
     * @param lease age after which a lease left by a dead process may be taken over
     */
    public record Lock(boolean enabled, Duration lease) {

        public Lock {
            if (lease == null || lease.isZero() || lease.isNegative()) {
                lease = MigrationSettings.DEFAULT_LOCK_LEASE;
            }
        }
    }

    public MigrationSettings toSettings() {
        return new MigrationSettings(Path.of(directory), ledgerTable, lock.enabled(), lock.lease());
    }
}
