package com.stratum.migration;

import java.util.List;

/**
 * Outcome of a reset.
 *
 * @param rolledBack entries removed, in the (descending) order they were rolled back
 * @param reapplied result of applying every migration again afterwards
 */
public record ResetResult(List<LedgerEntry> rolledBack, ApplyResult reapplied) {

    public ResetResult {
        rolledBack = List.copyOf(rolledBack);
    }
}
