package com.stratum.migration;

import com.stratum.migration.telemetry.MigrationMetrics;
import com.stratum.migration.telemetry.MigrationTracing;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies and rolls back migrations against one connection.
 *
 * <p>Every step (one forward or one rollback script) runs in its own transaction together with its
 * ledger change: either both commit or neither does. Pending migrations are applied strictly in
 * ascending version order and the run stops at the first failure, leaving earlier steps committed.
 *
 * <p>Commands are serialized within a process. Across processes the optional {@link MigrationLock}
 * makes a second writer fail fast instead of racing.
 */
public class MigrationExecutor {

    private static final Logger log = LoggerFactory.getLogger(MigrationExecutor.class);

    static final String SPAN_APPLY = "migration.apply";

    static final String SPAN_ROLLBACK = "migration.rollback";

    private final Connection connection;
    private final MigrationCatalog catalog;
    private final VersionLedger ledger;
    private final MigrationLock lock;
    private final MigrationMetrics metrics;
    private final MigrationTracing tracing;
    private final Clock clock;

    private volatile ExecutorState state = ExecutorState.IDLE;

    /** Executor without locking or telemetry. */
    public MigrationExecutor(Connection connection, MigrationCatalog catalog, VersionLedger ledger) {
        this(
                connection,
                catalog,
                ledger,
                null,
                MigrationMetrics.noop(),
                MigrationTracing.noop(),
                Clock.systemUTC());
    }

    /**
     * @param connection open connection; the caller owns its lifecycle
     * @param catalog scripts on disk
     * @param ledger ledger table on {@code connection}
     * @param lock lease taken around mutating commands, or null to run unlocked
     * @param metrics step counters and timers
     * @param tracing step spans
     * @param clock source of {@code applied_at}
     */
    public MigrationExecutor(
            Connection connection,
            MigrationCatalog catalog,
            VersionLedger ledger,
            MigrationLock lock,
            MigrationMetrics metrics,
            MigrationTracing tracing,
            Clock clock) {
        if (connection == null || catalog == null || ledger == null) {
            throw new IllegalArgumentException("connection, catalog and ledger are required");
        }
        this.connection = connection;
        this.catalog = catalog;
        this.ledger = ledger;
        this.lock = lock;
        this.metrics = metrics;
        this.tracing = tracing;
        this.clock = clock;
    }

    /**
     * Applies every migration in the catalog that is not in the ledger, in ascending version
     * order.
     *
     * @return the entries written; empty when the schema was already up to date
     * @throws ChecksumMismatchException if an applied script was modified on disk; nothing is
     *     applied
     * @throws MigrationExecutionException if a script fails; the run stops at that version
     */
    public synchronized ApplyResult applyPending() {
        ledger.ensureSchema();
        return withLock(this::doApplyPending);
    }

    /** Rolls back the highest applied version. A no-op when nothing is applied. */
    public synchronized Optional<LedgerEntry> rollback() {
        return rollback(null);
    }

    /**
     * Rolls back one applied migration using its paired rollback script.
     *
     * @param targetVersion version to roll back, or null for the highest applied version
     * @return the removed ledger entry, or empty when the ledger is empty
     * @throws MigrationNotFoundException if {@code targetVersion} is not in the ledger
     * @throws MissingRollbackScriptException if the rollback script does not exist
     */
    public synchronized Optional<LedgerEntry> rollback(Long targetVersion) {
        ledger.ensureSchema();
        return withLock(() -> doRollback(targetVersion));
    }

    /**
     * Rolls back every applied migration, highest version first, then applies everything again.
     * Each rollback is its own transaction, so a failure part way leaves a ledger that matches the
     * schema. The catalog is read before the first rollback, so a malformed or duplicate script
     * fails the reset while nothing has changed.
     */
    public synchronized ResetResult reset() {
        ledger.ensureSchema();
        return withLock(
                () -> {
                    catalog.listAll();
                    List<LedgerEntry> applied = new ArrayList<>(ledger.listApplied());
                    applied.sort(Comparator.comparingLong(LedgerEntry::version).reversed());
                    log.info("Resetting {} applied migration(s)", applied.size());

                    List<LedgerEntry> rolledBack = new ArrayList<>();
                    for (LedgerEntry entry : applied) {
                        rolledBack.add(revert(entry));
                    }
                    log.info("Re-applying all migrations");
                    return new ResetResult(rolledBack, doApplyPending());
                });
    }

    public ExecutorState state() {
        return state;
    }

    // ── Apply ──

    private ApplyResult doApplyPending() {
        state = ExecutorState.IDLE;
        List<MigrationDescriptor> all = catalog.listAll();
        List<LedgerEntry> applied = ledger.listApplied();
        verifyAppliedChecksums(all, applied);

        Set<Long> appliedVersions =
                applied.stream().map(LedgerEntry::version).collect(Collectors.toSet());
        List<MigrationDescriptor> pending =
                all.stream().filter(d -> !appliedVersions.contains(d.version())).toList();

        if (pending.isEmpty()) {
            log.info("All migrations are up to date ({} applied)", applied.size());
            return ApplyResult.upToDate();
        }

        log.info(
                "Found {} pending migration(s): {}", pending.size(), MigrationCatalog.names(pending));
        List<LedgerEntry> written = new ArrayList<>();
        for (MigrationDescriptor descriptor : pending) {
            apply(descriptor).ifPresent(written::add);
        }
        log.info("Applied {} migration(s)", written.size());
        return new ApplyResult(written);
    }

    /**
     * Re-checksums every applied script still present in the catalog. Drift in history is fatal
     * before any new version is touched. A script that vanished is left to the validator.
     */
    private void verifyAppliedChecksums(
            List<MigrationDescriptor> all, List<LedgerEntry> applied) {
        Map<Long, MigrationDescriptor> byVersion =
                all.stream()
                        .collect(Collectors.toMap(MigrationDescriptor::version, Function.identity()));
        for (LedgerEntry entry : applied) {
            MigrationDescriptor descriptor = byVersion.get(entry.version());
            if (descriptor == null) {
                log.warn(
                        "Applied migration {} (v{}) is no longer in {}",
                        entry.name(),
                        entry.version(),
                        catalog.directory());
                continue;
            }
            String actual = Checksums.sha256(catalog.read(descriptor.scriptPath()));
            if (!actual.equals(entry.checksum())) {
                throw new ChecksumMismatchException(
                        entry.version(), entry.name(), entry.checksum(), actual);
            }
        }
    }

    private Optional<LedgerEntry> apply(MigrationDescriptor descriptor) {
        byte[] content = catalog.read(descriptor.scriptPath());
        String checksum = Checksums.sha256(content);

        // Re-check right before executing: another process may have applied it meanwhile.
        Optional<LedgerEntry> existing = ledger.findByVersion(descriptor.version());
        if (existing.isPresent()) {
            if (existing.get().checksum().equals(checksum)) {
                log.info("Migration {} already applied", descriptor.scriptName());
                return Optional.empty();
            }
            throw new ChecksumMismatchException(
                    descriptor.version(),
                    descriptor.scriptName(),
                    existing.get().checksum(),
                    checksum);
        }

        renewLease();
        return Optional.of(
                tracing.inSpan(
                        SPAN_APPLY,
                        descriptor.version(),
                        descriptor.scriptName(),
                        () -> executeForward(descriptor, content, checksum)));
    }

    private LedgerEntry executeForward(
            MigrationDescriptor descriptor, byte[] content, String checksum) {
        log.info("Applying migration {}", descriptor.scriptName());
        String sql = new String(content, StandardCharsets.UTF_8);
        long start = System.nanoTime();
        state = ExecutorState.APPLYING;
        try {
            inTransaction(
                    () -> {
                        executeScript(sql);
                        ledger.insert(
                                new LedgerEntry(
                                        0,
                                        descriptor.version(),
                                        descriptor.scriptName(),
                                        checksum,
                                        clock.instant(),
                                        Duration.ofNanos(System.nanoTime() - start).toMillis()));
                        return null;
                    });
        } catch (SQLException e) {
            fail(MigrationMetrics.OPERATION_APPLY);
            log.error("Migration {} failed: {}", descriptor.scriptName(), e.getMessage());
            throw new MigrationExecutionException(
                    descriptor.version(), descriptor.scriptName(), e);
        } catch (RuntimeException e) {
            fail(MigrationMetrics.OPERATION_APPLY);
            throw e;
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        state = ExecutorState.COMMITTED;
        metrics.recordApplied(elapsed);
        log.info(
                "Migration {} applied successfully ({}ms)",
                descriptor.scriptName(),
                elapsed.toMillis());
        state = ExecutorState.IDLE;
        return ledger.findByVersion(descriptor.version())
                .orElseThrow(
                        () ->
                                new MigrationException(
                                        "Ledger entry for version "
                                                + descriptor.version()
                                                + " missing after commit"));
    }

    // ── Rollback ──

    private Optional<LedgerEntry> doRollback(Long targetVersion) {
        state = ExecutorState.IDLE;
        List<LedgerEntry> applied = ledger.listApplied();
        if (applied.isEmpty()) {
            log.info("No migrations to roll back");
            return Optional.empty();
        }

        LedgerEntry target;
        if (targetVersion == null) {
            target = applied.get(applied.size() - 1);
        } else {
            target =
                    applied.stream()
                            .filter(e -> e.version() == targetVersion)
                            .findFirst()
                            .orElseThrow(() -> new MigrationNotFoundException(targetVersion));
        }
        return Optional.of(revert(target));
    }

    private LedgerEntry revert(LedgerEntry entry) {
        Path rollbackScript =
                catalog.findRollbackScript(entry.name())
                        .orElseThrow(
                                () ->
                                        new MissingRollbackScriptException(
                                                entry.version(),
                                                entry.name(),
                                                catalog.rollbackPathFor(entry.name())));
        String sql = new String(catalog.read(rollbackScript), StandardCharsets.UTF_8);

        renewLease();
        return tracing.inSpan(
                SPAN_ROLLBACK, entry.version(), entry.name(), () -> executeRollback(entry, sql));
    }

    private LedgerEntry executeRollback(LedgerEntry entry, String sql) {
        log.info("Rolling back migration {}", entry.name());
        long start = System.nanoTime();
        state = ExecutorState.APPLYING;
        try {
            inTransaction(
                    () -> {
                        executeScript(sql);
                        if (ledger.deleteByVersion(entry.version()) != 1) {
                            throw new SQLException(
                                    "Ledger row for version "
                                            + entry.version()
                                            + " disappeared during rollback");
                        }
                        return null;
                    });
        } catch (SQLException e) {
            fail(MigrationMetrics.OPERATION_ROLLBACK);
            log.error("Rollback failed for {}: {}", entry.name(), e.getMessage());
            throw new MigrationExecutionException(entry.version(), entry.name(), e);
        } catch (RuntimeException e) {
            fail(MigrationMetrics.OPERATION_ROLLBACK);
            throw e;
        }

        state = ExecutorState.COMMITTED;
        metrics.recordRolledBack(Duration.ofNanos(System.nanoTime() - start));
        log.info("Rolled back migration {}", entry.name());
        state = ExecutorState.IDLE;
        return entry;
    }

    // ── Helpers ──

    private void executeScript(String sql) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            for (String sqlStatement : SqlScriptSplitter.split(sql)) {
                statement.execute(sqlStatement);
            }
        }
    }

    /**
     * Runs {@code work} in one transaction, restoring the connection's auto-commit mode after. When
     * the work fails, failures to roll back or to restore auto-commit are attached to it as
     * suppressed exceptions.
     */
    private <T> T inTransaction(SqlWork<T> work) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        T result;
        try {
            result = work.run();
            connection.commit();
        } catch (SQLException | RuntimeException e) {
            state = ExecutorState.ROLLED_BACK;
            try {
                connection.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            try {
                connection.setAutoCommit(autoCommit);
            } catch (SQLException restoreFailure) {
                e.addSuppressed(restoreFailure);
            }
            throw e;
        }
        connection.setAutoCommit(autoCommit);
        return result;
    }

    /** Fails the step before it runs if another process took the lease over. */
    private void renewLease() {
        if (lock != null) {
            lock.renew();
        }
    }

    private void fail(String operation) {
        state = ExecutorState.FAILED;
        metrics.recordFailure(operation);
    }

    private <T> T withLock(Supplier<T> work) {
        if (lock == null) {
            return work.get();
        }
        lock.acquire();
        T result;
        try {
            result = work.get();
        } catch (RuntimeException e) {
            try {
                lock.release();
            } catch (MigrationException releaseFailure) {
                e.addSuppressed(releaseFailure);
            }
            throw e;
        }
        lock.release();
        return result;
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run() throws SQLException;
    }
}
