package com.stratum.migration;

import java.util.List;

/**
 * Outcome of applying pending migrations.
 *
 * @param applied ledger entries written by this run, in apply order (empty when up to date)
 */
public record ApplyResult(List<LedgerEntry> applied) {

    public ApplyResult {
        applied = List.copyOf(applied);
    }

    public static ApplyResult upToDate() {
        return new ApplyResult(List.of());
    }

    public int appliedCount() {
        return applied.size();
    }

    public boolean upToDateAlready() {
        return applied.isEmpty();
    }
}
