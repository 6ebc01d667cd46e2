package com.stratum.migration;

/**
 * Base type for every failure raised by the migration engine.
 *
 * <p>All engine failures are fatal to the current command. Nothing is retried automatically: a
 * schema change that failed once needs an operator to look at it before it runs again.
 */
public class MigrationException extends RuntimeException {

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
