package com.stratum.migrator.cli;

import com.stratum.migration.ChecksumMismatchException;
import com.stratum.migration.MigrationException;
import com.stratum.migration.MigrationExecutionException;
import com.stratum.migration.MigrationLockException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps command failures to one line on stderr and a process exit code.
 *
 * <ul>
 *   <li>{@link IllegalArgumentException}: bad operator input, no stack trace
 *   <li>{@link MigrationException} and its subclasses: engine refused or a script failed
 *   <li>anything else: unexpected, logged with its stack trace
 * </ul>
 */
public class CommandFailureHandler {

    private static final Logger log = LoggerFactory.getLogger(CommandFailureHandler.class);

    public static final int EXIT_FAILURE = 1;

    private final ReportPrinter printer;

    public CommandFailureHandler(ReportPrinter printer) {
        this.printer = printer;
    }

    /** Reports {@code failure} and returns the exit code to use. Package-private for testing. */
    int handle(RuntimeException failure) {
        printer.error(describe(failure));
        if (failure instanceof MigrationException || failure instanceof IllegalArgumentException) {
            log.debug("Command failed", failure);
        } else {
            log.error("Unexpected migrator failure", failure);
        }
        return EXIT_FAILURE;
    }

    String describe(RuntimeException failure) {
        if (failure instanceof IllegalArgumentException) {
            return failure.getMessage();
        }
        if (failure instanceof ChecksumMismatchException mismatch) {
            return mismatch.getMessage() + ". Run 'validate' for a full report.";
        }
        if (failure instanceof MigrationLockException
                || failure instanceof MigrationExecutionException) {
            return failure.getMessage();
        }
        if (failure instanceof MigrationException) {
            return failure.getCause() != null
                    ? failure.getMessage() + ": " + failure.getCause().getMessage()
                    : failure.getMessage();
        }
        return "Unexpected error: " + failure;
    }
}
