package com.stratum.migration;

import java.util.List;

/**
 * Result of comparing the ledger against the scripts on disk.
 *
 * @param valid true when no violations were found
 * @param checked number of ledger entries examined
 * @param violations violations in ascending version order
 */
public record ValidationReport(boolean valid, int checked, List<IntegrityViolation> violations) {

    public ValidationReport {
        violations = List.copyOf(violations);
        if (valid && !violations.isEmpty()) {
            throw new IllegalArgumentException("a valid report cannot carry violations");
        }
    }

    public static ValidationReport of(int checked, List<IntegrityViolation> violations) {
        return new ValidationReport(violations.isEmpty(), checked, violations);
    }
}
