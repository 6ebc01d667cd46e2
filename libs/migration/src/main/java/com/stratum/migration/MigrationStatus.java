package com.stratum.migration;

import java.util.List;

/**
 * Applied and pending migrations at one point in time.
 *
 * @param applied ledger entries in ascending version order
 * @param pending scripts on disk not yet in the ledger, in ascending version order
 */
public record MigrationStatus(List<LedgerEntry> applied, List<MigrationDescriptor> pending) {

    public MigrationStatus {
        applied = List.copyOf(applied);
        pending = List.copyOf(pending);
    }

    public int appliedCount() {
        return applied.size();
    }

    public int pendingCount() {
        return pending.size();
    }

    /** Highest applied version, or null when nothing has been applied. */
    public Long currentVersion() {
        return applied.isEmpty() ? null : applied.get(applied.size() - 1).version();
    }
}
