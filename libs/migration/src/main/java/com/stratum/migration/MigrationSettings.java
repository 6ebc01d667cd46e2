package com.stratum.migration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Engine settings that do not depend on Spring. {@code MigrationProperties} in the config package
 * maps the externalized configuration onto this record.
 *
 * @param directory directory holding the forward scripts (rollbacks live in its {@code rollback}
 *     subdirectory)
 * @param ledgerTable name of the ledger table, a plain SQL identifier
 * @param lockEnabled whether mutating commands take the lease lock
 * @param lockLease age after which an abandoned lease may be taken over
 */
public record MigrationSettings(
        Path directory, String ledgerTable, boolean lockEnabled, Duration lockLease) {

    public static final String DEFAULT_LEDGER_TABLE = "schema_migrations";

    public static final Duration DEFAULT_LOCK_LEASE = Duration.ofMinutes(10);

    // Leaves room for the "_lock" suffix within PostgreSQL's 63 character identifier limit.
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,57}");

    public MigrationSettings {
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }
        if (ledgerTable == null || ledgerTable.isBlank()) {
            ledgerTable = DEFAULT_LEDGER_TABLE;
        }
        if (!IDENTIFIER.matcher(ledgerTable).matches()) {
            throw new IllegalArgumentException(
                    "ledgerTable must be a plain SQL identifier: " + ledgerTable);
        }
        if (lockLease == null || lockLease.isZero() || lockLease.isNegative()) {
            lockLease = DEFAULT_LOCK_LEASE;
        }
    }

    /** Settings with the default ledger table and locking enabled. */
    public static MigrationSettings forDirectory(Path directory) {
        return new MigrationSettings(directory, DEFAULT_LEDGER_TABLE, true, DEFAULT_LOCK_LEASE);
    }

    public String lockTable() {
        return ledgerTable + "_lock";
    }
}
