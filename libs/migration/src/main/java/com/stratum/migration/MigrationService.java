package com.stratum.migration;

import com.stratum.migration.telemetry.MigrationMetrics;
import com.stratum.migration.telemetry.MigrationTracing;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import javax.sql.DataSource;

/**
 * Entry point for hosts: the Spring startup hook, the health indicator and the operator CLI.
 *
 * <p>WHY: the engine components take an explicit {@link Connection}. This class owns the
 * connection scope instead: every call borrows a connection from the {@link DataSource}, wires the
 * catalog, ledger and executor around it, and closes it before returning. Mutating calls borrow a
 * second connection for the lease lock when locking is enabled.
 *
 * <p>This is a POJO (no Spring annotations) so it can be built in tests without a context. The
 * Spring wiring lives in {@code MigrationAutoConfiguration}.
 */
public class MigrationService {

    private final DataSource dataSource;
    private final MigrationSettings settings;
    private final MigrationMetrics metrics;
    private final MigrationTracing tracing;
    private final Clock clock;

    public MigrationService(DataSource dataSource, MigrationSettings settings) {
        this(
                dataSource,
                settings,
                MigrationMetrics.noop(),
                MigrationTracing.noop(),
                Clock.systemUTC());
    }

    public MigrationService(
            DataSource dataSource,
            MigrationSettings settings,
            MigrationMetrics metrics,
            MigrationTracing tracing,
            Clock clock) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        this.dataSource = dataSource;
        this.settings = settings;
        this.metrics = metrics;
        this.tracing = tracing;
        this.clock = clock;
    }

    /** Applies every pending migration. */
    public ApplyResult migrate() {
        return withExecutor(MigrationExecutor::applyPending);
    }

    /**
     * Rolls back one migration.
     *
     * @param targetVersion version to roll back, or null for the latest
     */
    public Optional<LedgerEntry> rollback(Long targetVersion) {
        return withExecutor(executor -> executor.rollback(targetVersion));
    }

    /** Rolls back everything, then applies everything. */
    public ResetResult reset() {
        return withExecutor(MigrationExecutor::reset);
    }

    public MigrationStatus status() {
        return withConnection(
                connection -> {
                    List<LedgerEntry> applied = ledger(connection).listApplied();
                    Set<Long> appliedVersions =
                            applied.stream()
                                    .map(LedgerEntry::version)
                                    .collect(Collectors.toSet());
                    List<MigrationDescriptor> pending =
                            catalog().listAll().stream()
                                    .filter(d -> !appliedVersions.contains(d.version()))
                                    .toList();
                    return new MigrationStatus(applied, pending);
                });
    }

    public ValidationReport validate() {
        return withConnection(
                connection -> new IntegrityValidator(catalog(), ledger(connection)).validate());
    }

    /** Scaffolds the next migration on disk. Does not touch the datastore. */
    public ScaffoldResult create(String name) {
        return new MigrationScaffolder(catalog()).create(name);
    }

    public MigrationSettings settings() {
        return settings;
    }

    // ── Private Helpers ──

    private MigrationCatalog catalog() {
        return new MigrationCatalog(settings.directory());
    }

    private VersionLedger ledger(Connection connection) {
        return new VersionLedger(connection, settings.ledgerTable());
    }

    /**
     * Runs {@code work} against an executor. With locking enabled the lease lives on a second
     * connection, so its heartbeat never writes inside a migration's transaction.
     */
    private <T> T withExecutor(Function<MigrationExecutor, T> work) {
        return withConnection(
                connection -> {
                    if (!settings.lockEnabled()) {
                        return work.apply(executor(connection, null));
                    }
                    try (Connection lockConnection = dataSource.getConnection()) {
                        MigrationLock lock =
                                MigrationLock.withHeartbeat(
                                        lockConnection, settings.lockTable(), settings.lockLease());
                        return work.apply(executor(connection, lock));
                    } catch (SQLException e) {
                        throw new MigrationException(
                                "Unable to obtain a database connection for the migration lock", e);
                    }
                });
    }

    private MigrationExecutor executor(Connection connection, MigrationLock lock) {
        return new MigrationExecutor(
                connection, catalog(), ledger(connection), lock, metrics, tracing, clock);
    }

    private <T> T withConnection(Function<Connection, T> work) {
        try (Connection connection = dataSource.getConnection()) {
            return work.apply(connection);
        } catch (SQLException e) {
            throw new MigrationException("Unable to obtain a database connection", e);
        }
    }
}
