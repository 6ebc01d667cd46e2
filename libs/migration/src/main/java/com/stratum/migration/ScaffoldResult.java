package com.stratum.migration;

import java.nio.file.Path;

/**
 * Files written by {@link MigrationScaffolder#create(String)}.
 *
 * @param version version assigned to the new migration
 * @param scriptPath the forward script
 * @param rollbackPath the rollback stub
 */
public record ScaffoldResult(long version, Path scriptPath, Path rollbackPath) {}
