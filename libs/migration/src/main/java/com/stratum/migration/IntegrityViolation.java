package com.stratum.migration;

/**
 * One ledger entry whose on-disk script no longer matches what was applied.
 *
 * @param version migration version
 * @param scriptName script file name recorded in the ledger
 * @param type what is wrong with the script
 * @param expectedChecksum checksum recorded at apply time
 * @param actualChecksum checksum of the file on disk, or null when the file is missing
 */
public record IntegrityViolation(
        long version,
        String scriptName,
        ViolationType type,
        String expectedChecksum,
        String actualChecksum) {

    public enum ViolationType {
        CHECKSUM_MISMATCH,
        MISSING_FILE
    }

    public static IntegrityViolation checksumMismatch(LedgerEntry entry, String actualChecksum) {
        return new IntegrityViolation(
                entry.version(),
                entry.name(),
                ViolationType.CHECKSUM_MISMATCH,
                entry.checksum(),
                actualChecksum);
    }

    public static IntegrityViolation missingFile(LedgerEntry entry) {
        return new IntegrityViolation(
                entry.version(), entry.name(), ViolationType.MISSING_FILE, entry.checksum(), null);
    }

    /** One-line operator message. */
    public String describe() {
        return switch (type) {
            case CHECKSUM_MISMATCH -> String.format(
                    "%s (v%d): checksum mismatch, expected %s, got %s",
                    scriptName, version, expectedChecksum, actualChecksum);
            case MISSING_FILE -> String.format(
                    "%s (v%d): migration file not found", scriptName, version);
        };
    }
}
