package com.stratum.migration;

import java.sql.SQLException;

/**
 * Thrown when a forward or rollback script fails against the datastore.
 *
 * <p>The surrounding transaction has already been rolled back when this is raised, so neither the
 * schema change nor the ledger change persisted. Earlier, already committed migrations stay
 * applied.
 */
public class MigrationExecutionException extends MigrationException {

    private final long version;
    private final String scriptName;

    public MigrationExecutionException(long version, String scriptName, SQLException cause) {
        super("Migration %s (v%d) failed: %s".formatted(scriptName, version, cause.getMessage()),
                cause);
        this.version = version;
        this.scriptName = scriptName;
    }

    public long version() {
        return version;
    }

    public String scriptName() {
        return scriptName;
    }
}
