package com.stratum.migration;

import static com.stratum.migration.MigrationFixtures.count;
import static com.stratum.migration.MigrationFixtures.tableExists;
import static com.stratum.migration.MigrationFixtures.writeRollback;
import static com.stratum.migration.MigrationFixtures.writeScript;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.stratum.migration.telemetry.MigrationMetrics;
import com.stratum.migration.telemetry.MigrationTracing;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Executor behaviour against an in-memory H2 database.
 *
 * <p>H2 commits DDL implicitly, so tests that prove a failed step left nothing behind use DML
 * (inserts into an existing table) for the part that must be undone.
 */
@DisplayName("MigrationExecutor")
class MigrationExecutorTest {

    private static final String LEDGER = "schema_migrations";

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @TempDir Path directory;

    private String url;
    private Connection connection;
    private SimpleMeterRegistry registry;
    private MigrationExecutor executor;

    @BeforeEach
    void setUp() {
        url = MigrationFixtures.uniqueH2Url();
        connection = MigrationFixtures.openConnection(url);
        registry = new SimpleMeterRegistry();
        executor = executor(null);
    }

    @AfterEach
    void tearDown() throws SQLException {
        connection.close();
    }

    private MigrationExecutor executor(MigrationLock lock) {
        return new MigrationExecutor(
                connection,
                new MigrationCatalog(directory),
                new VersionLedger(connection, LEDGER),
                lock,
                new MigrationMetrics(registry),
                MigrationTracing.noop(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private VersionLedger ledger() {
        return new VersionLedger(connection, LEDGER);
    }

    private void writeUsersMigrations() {
        writeScript(
                directory,
                "001_create_users.sql",
                "CREATE TABLE users (id INT PRIMARY KEY, name VARCHAR(50));");
        writeRollback(directory, "001_create_users.sql", "DROP TABLE users;");
        writeScript(
                directory,
                "002_add_email.sql",
                "ALTER TABLE users ADD COLUMN email VARCHAR(100);");
        writeRollback(directory, "002_add_email.sql", "ALTER TABLE users DROP COLUMN email;");
    }

    private void writeSeedMigration() {
        writeScript(
                directory,
                "003_seed_users.sql",
                "INSERT INTO users (id, name) VALUES (1, 'ada');\n"
                        + "INSERT INTO users (id, name) VALUES (2, 'grace');");
        writeRollback(directory, "003_seed_users.sql", "DELETE FROM users WHERE id IN (1, 2);");
    }

    @Nested
    @DisplayName("applyPending")
    class ApplyPending {

        @Test
        @DisplayName("applies every pending migration and records it in the ledger")
        void appliesAll() throws SQLException {
            writeUsersMigrations();

            ApplyResult result = executor.applyPending();

            assertThat(result.appliedCount()).isEqualTo(2);
            assertThat(result.applied())
                    .extracting(LedgerEntry::name)
                    .containsExactly("001_create_users.sql", "002_add_email.sql");
            assertThat(tableExists(connection, "users")).isTrue();
            assertThat(count(connection, "SELECT COUNT(*) FROM " + LEDGER)).isEqualTo(2);

            LedgerEntry first = ledger().findByVersion(1).orElseThrow();
            assertThat(first.appliedAt()).isEqualTo(NOW);
            assertThat(first.checksum())
                    .isEqualTo(
                            Checksums.sha256(
                                    new MigrationCatalog(directory)
                                            .read(directory.resolve("001_create_users.sql"))));
        }

        @Test
        @DisplayName("a second run applies nothing and reports up to date")
        void idempotent() {
            writeUsersMigrations();
            executor.applyPending();

            ApplyResult second = executor.applyPending();

            assertThat(second.upToDateAlready()).isTrue();
            assertThat(second.appliedCount()).isZero();
            assertThat(ledger().listApplied()).hasSize(2);
        }

        @Test
        @DisplayName("an empty directory is up to date and still creates the ledger")
        void emptyDirectory() {
            ApplyResult result = executor.applyPending();

            assertThat(result.upToDateAlready()).isTrue();
            assertThat(ledger().exists()).isTrue();
        }

        @Test
        @DisplayName("applies version 9 before version 10")
        void numericOrder() {
            writeScript(directory, "10_insert.sql", "INSERT INTO t VALUES (10);");
            writeScript(directory, "9_create.sql", "CREATE TABLE t (n INT);");

            ApplyResult result = executor.applyPending();

            assertThat(result.applied()).extracting(LedgerEntry::version).containsExactly(9L, 10L);
        }

        @Test
        @DisplayName("only applies migrations added since the last run")
        void appliesOnlyNew() throws SQLException {
            writeUsersMigrations();
            executor.applyPending();
            writeSeedMigration();

            ApplyResult result = executor.applyPending();

            assertThat(result.applied()).extracting(LedgerEntry::version).containsExactly(3L);
            assertThat(count(connection, "SELECT COUNT(*) FROM users")).isEqualTo(2);
        }

        @Test
        @DisplayName("restores the connection's auto-commit mode")
        void restoresAutoCommit() throws SQLException {
            writeUsersMigrations();

            executor.applyPending();

            assertThat(connection.getAutoCommit()).isTrue();
            assertThat(executor.state()).isEqualTo(ExecutorState.IDLE);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("a failing script leaves neither its changes nor a ledger row, and stops")
        void failingScriptIsAtomic() throws SQLException {
            writeUsersMigrations();
            writeScript(
                    directory,
                    "003_seed_users.sql",
                    "INSERT INTO users (id, name) VALUES (1, 'ada');\n"
                            + "INSERT INTO no_such_table VALUES (1);");
            writeScript(directory, "004_audit.sql", "CREATE TABLE audit (id INT);");

            assertThatThrownBy(() -> executor.applyPending())
                    .isInstanceOf(MigrationExecutionException.class)
                    .hasCauseInstanceOf(SQLException.class)
                    .hasMessageContaining("003_seed_users.sql")
                    .isInstanceOfSatisfying(
                            MigrationExecutionException.class,
                            e -> assertThat(e.version()).isEqualTo(3L));

            assertThat(count(connection, "SELECT COUNT(*) FROM users")).isZero();
            assertThat(ledger().listApplied())
                    .extracting(LedgerEntry::version)
                    .containsExactly(1L, 2L);
            assertThat(tableExists(connection, "audit")).isFalse();
            assertThat(executor.state()).isEqualTo(ExecutorState.FAILED);
            assertThat(connection.getAutoCommit()).isTrue();
        }

        @Test
        @DisplayName("counts the failure by operation")
        void failureMetric() {
            writeScript(directory, "001_bad.sql", "INSERT INTO no_such_table VALUES (1);");

            assertThatThrownBy(() -> executor.applyPending())
                    .isInstanceOf(MigrationExecutionException.class);

            assertThat(
                            registry.get(MigrationMetrics.FAILED)
                                    .tag(MigrationMetrics.TAG_OPERATION, "apply")
                                    .counter()
                                    .count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("refuses to apply anything when an applied script was edited")
        void driftBlocksApply() throws SQLException {
            writeUsersMigrations();
            executor.applyPending();
            writeScript(
                    directory,
                    "002_add_email.sql",
                    "ALTER TABLE users ADD COLUMN email VARCHAR(200);");
            writeScript(directory, "003_audit.sql", "CREATE TABLE audit (id INT);");

            assertThatThrownBy(() -> executor.applyPending())
                    .isInstanceOf(ChecksumMismatchException.class)
                    .hasMessageContaining("002_add_email.sql")
                    .hasMessageContaining("v2");

            assertThat(tableExists(connection, "audit")).isFalse();
            assertThat(ledger().listApplied()).hasSize(2);
        }

        @Test
        @DisplayName("a script that disappeared after being applied does not block new ones")
        void missingAppliedScriptOnlyWarns() throws Exception {
            writeUsersMigrations();
            executor.applyPending();
            Files.delete(directory.resolve("002_add_email.sql"));
            writeScript(directory, "003_audit.sql", "CREATE TABLE audit (id INT);");

            ApplyResult result = executor.applyPending();

            assertThat(result.applied()).extracting(LedgerEntry::version).containsExactly(3L);
        }
    }

    @Nested
    @DisplayName("Connection failures")
    class ConnectionFailures {

        @Test
        @DisplayName("keeps the script failure when auto-commit cannot be restored")
        void restoreFailureIsSuppressed() throws SQLException {
            writeScript(directory, "001_bad.sql", "INSERT INTO missing VALUES (1);");
            Connection broken = mock(Connection.class);
            Statement statement = mock(Statement.class);
            when(broken.getAutoCommit()).thenReturn(true);
            when(broken.createStatement()).thenReturn(statement);
            when(statement.execute(anyString())).thenThrow(new SQLException("table not found"));
            doThrow(new SQLException("connection reset")).when(broken).setAutoCommit(true);
            VersionLedger brokenLedger = mock(VersionLedger.class);
            when(brokenLedger.listApplied()).thenReturn(List.of());
            when(brokenLedger.findByVersion(1)).thenReturn(Optional.empty());

            MigrationExecutor brokenExecutor =
                    new MigrationExecutor(broken, new MigrationCatalog(directory), brokenLedger);

            assertThatThrownBy(brokenExecutor::applyPending)
                    .isInstanceOfSatisfying(
                            MigrationExecutionException.class,
                            e -> {
                                assertThat(e.getCause()).hasMessage("table not found");
                                assertThat(e.getCause().getSuppressed())
                                        .extracting(Throwable::getMessage)
                                        .containsExactly("connection reset");
                            });
            verify(broken).rollback();
        }
    }

    @Nested
    @DisplayName("rollback")
    class Rollback {

        @Test
        @DisplayName("rolls back only the highest applied version")
        void latestOnly() throws SQLException {
            writeUsersMigrations();
            writeSeedMigration();
            executor.applyPending();

            var rolledBack = executor.rollback();

            assertThat(rolledBack).map(LedgerEntry::version).contains(3L);
            assertThat(ledger().listApplied())
                    .extracting(LedgerEntry::version)
                    .containsExactly(1L, 2L);
            assertThat(count(connection, "SELECT COUNT(*) FROM users")).isZero();
        }

        @Test
        @DisplayName("rollback followed by apply restores schema and ledger")
        void rollbackThenApply() throws SQLException {
            writeUsersMigrations();
            executor.applyPending();

            executor.rollback();
            executor.rollback();
            assertThat(tableExists(connection, "users")).isFalse();
            assertThat(ledger().listApplied()).isEmpty();

            executor.applyPending();
            assertThat(tableExists(connection, "users")).isTrue();
            assertThat(ledger().listApplied()).hasSize(2);
        }

        @Test
        @DisplayName("rolls back a specific version")
        void specificVersion() {
            writeUsersMigrations();
            writeSeedMigration();
            executor.applyPending();

            executor.rollback(3L);

            assertThat(ledger().findByVersion(3)).isEmpty();
            assertThat(ledger().findByVersion(2)).isPresent();
        }

        @Test
        @DisplayName("fails without touching anything when the rollback script is missing")
        void missingRollbackScript() throws SQLException {
            writeScript(directory, "001_create_users.sql", "CREATE TABLE users (id INT);");
            writeScript(directory, "002_add_email.sql", "ALTER TABLE users ADD COLUMN email INT;");
            writeScript(directory, "003_more.sql", "CREATE TABLE more (id INT);");
            executor.applyPending();

            assertThatThrownBy(() -> executor.rollback(2L))
                    .isInstanceOf(MissingRollbackScriptException.class)
                    .hasMessageContaining("002_add_email.rollback.sql");

            assertThat(ledger().listApplied()).hasSize(3);
            assertThat(tableExists(connection, "more")).isTrue();
        }

        @Test
        @DisplayName("fails for a version that is not in the ledger")
        void unknownVersion() {
            writeUsersMigrations();
            executor.applyPending();

            assertThatThrownBy(() -> executor.rollback(99L))
                    .isInstanceOf(MigrationNotFoundException.class)
                    .hasMessageContaining("99");
        }

        @Test
        @DisplayName("is a no-op when nothing has been applied")
        void emptyLedger() {
            assertThat(executor.rollback()).isEmpty();
            assertThat(executor.rollback(5L)).isEmpty();
        }

        @Test
        @DisplayName("a failing rollback script keeps the ledger row and the data")
        void failingRollbackIsAtomic() throws SQLException {
            writeUsersMigrations();
            writeSeedMigration();
            executor.applyPending();
            writeRollback(
                    directory,
                    "003_seed_users.sql",
                    "DELETE FROM users WHERE id IN (1, 2);\nINSERT INTO no_such_table VALUES (1);");

            assertThatThrownBy(() -> executor.rollback())
                    .isInstanceOf(MigrationExecutionException.class);

            assertThat(ledger().findByVersion(3)).isPresent();
            assertThat(count(connection, "SELECT COUNT(*) FROM users")).isEqualTo(2);
            assertThat(executor.state()).isEqualTo(ExecutorState.FAILED);
        }

        @Test
        @DisplayName("counts rolled back steps")
        void rollbackMetric() {
            writeUsersMigrations();
            executor.applyPending();

            executor.rollback();

            assertThat(registry.get(MigrationMetrics.ROLLED_BACK).counter().count())
                    .isEqualTo(1.0);
            assertThat(registry.get(MigrationMetrics.APPLIED).counter().count()).isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("reset")
    class Reset {

        @Test
        @DisplayName("rolls back in descending order, then re-applies everything")
        void resetsAll() throws SQLException {
            writeUsersMigrations();
            writeSeedMigration();
            executor.applyPending();

            ResetResult result = executor.reset();

            assertThat(result.rolledBack())
                    .extracting(LedgerEntry::version)
                    .containsExactly(3L, 2L, 1L);
            assertThat(result.reapplied().applied())
                    .extracting(LedgerEntry::version)
                    .containsExactly(1L, 2L, 3L);
            assertThat(count(connection, "SELECT COUNT(*) FROM users")).isEqualTo(2);
        }

        @Test
        @DisplayName("stops at a missing rollback script, keeping what was already undone")
        void stopsAtMissingRollback() {
            writeUsersMigrations();
            writeScript(directory, "003_more.sql", "CREATE TABLE more (id INT);");
            executor.applyPending();

            assertThatThrownBy(() -> executor.reset())
                    .isInstanceOf(MissingRollbackScriptException.class);

            assertThat(ledger().listApplied()).hasSize(3);
        }

        @Test
        @DisplayName("rejects a malformed script name before rolling anything back")
        void malformedCatalogChangesNothing() throws SQLException {
            writeUsersMigrations();
            executor.applyPending();
            writeScript(directory, "notes.sql", "SELECT 1;");

            assertThatThrownBy(() -> executor.reset())
                    .isInstanceOf(MalformedVersionException.class);

            assertThat(ledger().listApplied()).hasSize(2);
            assertThat(tableExists(connection, "users")).isTrue();
        }
    }

    @Nested
    @DisplayName("Locking")
    class Locking {

        private MigrationLock lock(String owner) {
            return new MigrationLock(
                    connection,
                    LEDGER + "_lock",
                    Duration.ofMinutes(10),
                    owner,
                    Clock.fixed(NOW, ZoneOffset.UTC));
        }

        @Test
        @DisplayName("releases the lease after a successful run")
        void releasesAfterRun() {
            writeUsersMigrations();
            MigrationLock lock = lock("runner");

            executor(lock).applyPending();

            assertThat(lock.holder()).isEmpty();
        }

        @Test
        @DisplayName("releases the lease after a failed run")
        void releasesAfterFailure() {
            writeScript(directory, "001_bad.sql", "INSERT INTO no_such_table VALUES (1);");
            MigrationLock lock = lock("runner");

            assertThatThrownBy(() -> executor(lock).applyPending())
                    .isInstanceOf(MigrationExecutionException.class);

            assertThat(lock.holder()).isEmpty();
        }

        @Test
        @DisplayName("fails fast while another owner holds the lease")
        void heldLease() {
            writeUsersMigrations();
            lock("other-host").acquire();

            assertThatThrownBy(() -> executor(lock("runner")).applyPending())
                    .isInstanceOf(MigrationLockException.class)
                    .hasMessageContaining("other-host");

            assertThat(ledger().listApplied()).isEmpty();
        }

        @Test
        @DisplayName("stops before the next step once the lease was taken over")
        void leaseLostMidRun() {
            writeScript(
                    directory,
                    "001_takeover.sql",
                    "UPDATE " + LEDGER + "_lock SET locked_by = 'other-host';");
            writeScript(directory, "002_more.sql", "CREATE TABLE more (id INT);");

            assertThatThrownBy(() -> executor(lock("runner")).applyPending())
                    .isInstanceOf(MigrationLockException.class)
                    .hasMessageContaining("was lost")
                    .hasMessageContaining("other-host");

            assertThat(ledger().listApplied())
                    .extracting(LedgerEntry::version)
                    .containsExactly(1L);
        }
    }
}
