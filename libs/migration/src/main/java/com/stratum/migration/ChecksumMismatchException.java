package com.stratum.migration;

/**
 * Thrown when an applied script's on-disk content no longer matches the checksum recorded in the
 * ledger.
 *
 * <p>The recorded checksum is treated as the truth. The engine refuses to apply anything further
 * until the script is restored.
 */
public class ChecksumMismatchException extends MigrationException {

    private final long version;
    private final String scriptName;
    private final String expectedChecksum;
    private final String actualChecksum;

    public ChecksumMismatchException(
            long version, String scriptName, String expectedChecksum, String actualChecksum) {
        super("Migration %s (v%d) has been modified since it was applied. Expected checksum: %s, got: %s"
                .formatted(scriptName, version, expectedChecksum, actualChecksum));
        this.version = version;
        this.scriptName = scriptName;
        this.expectedChecksum = expectedChecksum;
        this.actualChecksum = actualChecksum;
    }

    public long version() {
        return version;
    }

    public String scriptName() {
        return scriptName;
    }

    public String expectedChecksum() {
        return expectedChecksum;
    }

    public String actualChecksum() {
        return actualChecksum;
    }
}
