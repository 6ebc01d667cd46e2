package com.stratum.migration;

import java.nio.file.Path;

/** Thrown when a rollback is requested for a migration that has no paired rollback script. */
public class MissingRollbackScriptException extends MigrationException {

    private final long version;
    private final String scriptName;
    private final Path expectedPath;

    public MissingRollbackScriptException(long version, String scriptName, Path expectedPath) {
        super("No rollback file found for migration %s (v%d), expected %s"
                .formatted(scriptName, version, expectedPath));
        this.version = version;
        this.scriptName = scriptName;
        this.expectedPath = expectedPath;
    }

    public long version() {
        return version;
    }

    public String scriptName() {
        return scriptName;
    }

    public Path expectedPath() {
        return expectedPath;
    }
}
