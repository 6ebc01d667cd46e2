package com.stratum.migration;

import java.nio.file.Path;
import java.util.Optional;

/**
 * A forward migration script discovered on disk. Derived on every invocation, never persisted.
 *
 * @param version numeric version parsed from the file name prefix
 * @param description the part of the file name after the version separator (e.g. {@code add_col})
 * @param scriptPath location of the forward script
 * @param rollbackPath location of the paired rollback script, or null if there is none
 */
public record MigrationDescriptor(
        long version, String description, Path scriptPath, Path rollbackPath) {

    /** File name of the forward script (e.g. {@code 002_add_col.sql}), as stored in the ledger. */
    public String scriptName() {
        return scriptPath.getFileName().toString();
    }

    public Optional<Path> rollbackScript() {
        return Optional.ofNullable(rollbackPath);
    }
}
