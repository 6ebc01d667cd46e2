package com.stratum.migration;

/**
 * Lifecycle of a {@link MigrationExecutor} step.
 *
 * <p>{@code IDLE -> APPLYING -> COMMITTED -> IDLE} on success, {@code APPLYING -> ROLLED_BACK ->
 * FAILED} when a script or its commit fails. The next command starts again from {@code IDLE}.
 */
public enum ExecutorState {

    /** No step in progress. */
    IDLE,

    /** A script and its ledger change are executing inside an open transaction. */
    APPLYING,

    /** The step's transaction committed. */
    COMMITTED,

    /** The step's transaction was rolled back after a failure. */
    ROLLED_BACK,

    /** The last step failed; the command stopped there. */
    FAILED
}
