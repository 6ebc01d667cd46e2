/**
 * Versioned schema migration engine.
 *
 * <p>Forward scripts named {@code <version>_<name>.sql} are discovered by {@link
 * com.stratum.migration.MigrationCatalog}, applied in ascending numeric order by {@link
 * com.stratum.migration.MigrationExecutor}, and recorded in the ledger table managed by {@link
 * com.stratum.migration.VersionLedger}. Each applied script's SHA-256 checksum is stored so that
 * {@link com.stratum.migration.IntegrityValidator} can detect scripts edited after the fact.
 *
 * <p>Components take an explicit {@link java.sql.Connection}; {@link
 * com.stratum.migration.MigrationService} opens and closes one per command from a {@link
 * javax.sql.DataSource}.
 *
 * @see com.stratum.migration.config.MigrationAutoConfiguration
 */
package com.stratum.migration;
