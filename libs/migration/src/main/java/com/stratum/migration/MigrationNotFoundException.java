package com.stratum.migration;

/** Thrown when a rollback targets a version that is not recorded in the ledger. */
public class MigrationNotFoundException extends MigrationException {

    private final long version;

    public MigrationNotFoundException(long version) {
        super("Migration version %d not found in the ledger".formatted(version));
        this.version = version;
    }

    public long version() {
        return version;
    }
}
