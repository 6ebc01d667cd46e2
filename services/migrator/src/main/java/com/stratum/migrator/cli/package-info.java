/**
 * Command dispatch and operator output for the migrator.
 *
 * <p>{@link com.stratum.migrator.cli.MigratorCommandRunner} parses the arguments with {@link
 * com.stratum.migrator.cli.CommandLineArguments}, calls the migration service, and renders results
 * through {@link com.stratum.migrator.cli.ReportPrinter}.
 */
package com.stratum.migrator.cli;
