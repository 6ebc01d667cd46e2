package com.stratum.migration;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recomputes the checksum of every applied script and reports drift against the ledger.
 *
 * <p>Read-only: it never creates the ledger table and never repairs anything. Pending scripts are
 * not examined.
 */
public class IntegrityValidator {

    private static final Logger log = LoggerFactory.getLogger(IntegrityValidator.class);

    private final MigrationCatalog catalog;
    private final VersionLedger ledger;

    public IntegrityValidator(MigrationCatalog catalog, VersionLedger ledger) {
        if (catalog == null || ledger == null) {
            throw new IllegalArgumentException("catalog and ledger must not be null");
        }
        this.catalog = catalog;
        this.ledger = ledger;
    }

    public ValidationReport validate() {
        List<LedgerEntry> applied = ledger.listApplied();
        List<IntegrityViolation> violations = new ArrayList<>();

        for (LedgerEntry entry : applied) {
            Optional<Path> script = catalog.findScript(entry.name());
            if (script.isEmpty()) {
                log.warn("Applied migration {} (v{}) is missing", entry.name(), entry.version());
                violations.add(IntegrityViolation.missingFile(entry));
                continue;
            }
            String actual = Checksums.sha256(catalog.read(script.get()));
            if (!actual.equals(entry.checksum())) {
                log.warn(
                        "Applied migration {} (v{}) was modified: expected {}, got {}",
                        entry.name(),
                        entry.version(),
                        entry.checksum(),
                        actual);
                violations.add(IntegrityViolation.checksumMismatch(entry, actual));
            }
        }

        ValidationReport report = ValidationReport.of(applied.size(), violations);
        log.info(
                "Validated {} applied migration(s), {} violation(s)",
                report.checked(),
                report.violations().size());
        return report;
    }
}
