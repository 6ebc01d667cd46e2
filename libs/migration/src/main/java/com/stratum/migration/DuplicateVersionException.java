package com.stratum.migration;

import java.util.List;

/** Thrown when two forward scripts in the catalog resolve to the same version number. */
public class DuplicateVersionException extends MigrationException {

    private final long version;
    private final List<String> scriptNames;

    public DuplicateVersionException(long version, List<String> scriptNames) {
        super("Migration version %d is declared by more than one script: %s"
                .formatted(version, String.join(", ", scriptNames)));
        this.version = version;
        this.scriptNames = List.copyOf(scriptNames);
    }

    public long version() {
        return version;
    }

    public List<String> scriptNames() {
        return scriptNames;
    }
}
