package com.stratum.migration;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lease row that keeps two processes from applying or rolling back migrations at the same time.
 *
 * <p>The lock table holds at most one row ({@code lock_id = 1}). Acquiring inserts that row; the
 * primary key makes a second insert fail, which is reported as {@link MigrationLockException}. A
 * process that dies while holding the lease leaves its row behind, so a row whose last renewal is
 * older than the lease duration is deleted before the insert is attempted.
 *
 * <p>A live holder keeps its lease by calling {@link #renew()}; the executor does so before every
 * step. A lock created with {@link #withHeartbeat} also renews from a background thread every third
 * of the lease, which covers a single step that runs longer than the lease. The heartbeat issues
 * statements while the executor's connection is inside a transaction, so it needs a connection of
 * its own.
 *
 * <p>Renewal times are stored as UTC epoch milliseconds, so hosts in different time zones agree on
 * a lease's age. All statements run in auto-commit mode.
 */
public class MigrationLock {

    private static final Logger log = LoggerFactory.getLogger(MigrationLock.class);

    private static final int LOCK_ID = 1;

    private final Connection connection;
    private final String table;
    private final Duration lease;
    private final String owner;
    private final Clock clock;
    private final boolean heartbeat;

    // Guarded by this.
    private boolean held;
    private ScheduledExecutorService heartbeatScheduler;

    public MigrationLock(Connection connection, String table, Duration lease) {
        this(connection, table, lease, defaultOwner(), Clock.systemUTC(), false);
    }

    public MigrationLock(
            Connection connection, String table, Duration lease, String owner, Clock clock) {
        this(connection, table, lease, owner, clock, false);
    }

    /**
     * @param connection connection the lock statements run on
     * @param table lock table name, already validated as a plain identifier
     * @param lease age after which an unrenewed lease may be taken over
     * @param owner identity written into the lease row
     * @param clock source of renewal times
     * @param heartbeat whether to renew the lease from a background thread while held
     */
    public MigrationLock(
            Connection connection,
            String table,
            Duration lease,
            String owner,
            Clock clock,
            boolean heartbeat) {
        if (connection == null) {
            throw new IllegalArgumentException("connection must not be null");
        }
        if (lease == null || lease.isZero() || lease.isNegative()) {
            throw new IllegalArgumentException("lease must be positive");
        }
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner must not be null or blank");
        }
        this.connection = connection;
        this.table = table;
        this.lease = lease;
        this.owner = owner;
        this.clock = clock;
        this.heartbeat = heartbeat;
    }

    /**
     * A lock that renews its lease in the background while held.
     *
     * @param dedicatedConnection connection used by nothing but this lock
     */
    public static MigrationLock withHeartbeat(
            Connection dedicatedConnection, String table, Duration lease) {
        return new MigrationLock(
                dedicatedConnection, table, lease, defaultOwner(), Clock.systemUTC(), true);
    }

    /**
     * Takes the lease.
     *
     * @throws MigrationLockException if another owner holds an unexpired lease
     */
    public synchronized void acquire() {
        try {
            ensureTable();
            expireStaleLease();
            try (PreparedStatement insert =
                    connection.prepareStatement(
                            "INSERT INTO "
                                    + table
                                    + " (lock_id, locked_by, renewed_at_ms) VALUES (?, ?, ?)")) {
                insert.setInt(1, LOCK_ID);
                insert.setString(2, owner);
                insert.setLong(3, clock.millis());
                insert.executeUpdate();
            }
            held = true;
            log.debug("Acquired migration lock {} as {}", table, owner);
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                throw new MigrationLockException(describeHolder(e), e);
            }
            throw new MigrationException("Unable to acquire migration lock " + table, e);
        }
        if (heartbeat) {
            startHeartbeat();
        }
    }

    /**
     * Extends the lease to a full lease duration from now.
     *
     * @throws MigrationLockException if the lease was taken over by another owner or released
     */
    public synchronized void renew() {
        try (PreparedStatement update =
                connection.prepareStatement(
                        "UPDATE "
                                + table
                                + " SET renewed_at_ms = ? WHERE lock_id = ? AND locked_by = ?")) {
            update.setLong(1, clock.millis());
            update.setInt(2, LOCK_ID);
            update.setString(3, owner);
            if (update.executeUpdate() == 0) {
                String current = queryHolder().orElse("nobody");
                throw MigrationLockException.leaseLost(owner, current);
            }
            log.trace("Renewed migration lock {}", table);
        } catch (SQLException e) {
            throw new MigrationException("Unable to renew migration lock " + table, e);
        }
    }

    /** Gives the lease back. Only the row written by this owner is removed. */
    public synchronized void release() {
        held = false;
        stopHeartbeat();
        try (PreparedStatement delete =
                connection.prepareStatement(
                        "DELETE FROM " + table + " WHERE lock_id = ? AND locked_by = ?")) {
            delete.setInt(1, LOCK_ID);
            delete.setString(2, owner);
            delete.executeUpdate();
            log.debug("Released migration lock {}", table);
        } catch (SQLException e) {
            throw new MigrationException("Unable to release migration lock " + table, e);
        }
    }

    /** The current lease holder, if any. */
    public synchronized Optional<String> holder() {
        try {
            return queryHolder();
        } catch (SQLException e) {
            throw new MigrationException("Unable to read migration lock " + table, e);
        }
    }

    public String owner() {
        return owner;
    }

    /** How often the background heartbeat renews the lease. */
    Duration heartbeatInterval() {
        return lease.dividedBy(3);
    }

    // ── Private Helpers ──

    private void ensureTable() throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(
                    "CREATE TABLE IF NOT EXISTS "
                            + table
                            + " (lock_id INT NOT NULL PRIMARY KEY, "
                            + "locked_by VARCHAR(255) NOT NULL, "
                            + "renewed_at_ms BIGINT NOT NULL)");
        }
    }

    private void expireStaleLease() throws SQLException {
        long cutoff = clock.millis() - lease.toMillis();
        try (PreparedStatement delete =
                connection.prepareStatement(
                        "DELETE FROM " + table + " WHERE lock_id = ? AND renewed_at_ms < ?")) {
            delete.setInt(1, LOCK_ID);
            delete.setLong(2, cutoff);
            if (delete.executeUpdate() > 0) {
                log.warn(
                        "Took over migration lock {} not renewed since {}",
                        table,
                        Instant.ofEpochMilli(cutoff));
            }
        }
    }

    private Optional<String> queryHolder() throws SQLException {
        try (PreparedStatement select =
                connection.prepareStatement(
                        "SELECT locked_by, renewed_at_ms FROM " + table + " WHERE lock_id = ?")) {
            select.setInt(1, LOCK_ID);
            try (ResultSet row = select.executeQuery()) {
                if (!row.next()) {
                    return Optional.empty();
                }
                return Optional.of(
                        row.getString("locked_by")
                                + " since "
                                + Instant.ofEpochMilli(row.getLong("renewed_at_ms")));
            }
        }
    }

    private String describeHolder(SQLException failure) {
        try {
            return queryHolder().orElse("unknown owner");
        } catch (SQLException e) {
            failure.addSuppressed(e);
            return "unknown owner";
        }
    }

    private synchronized void startHeartbeat() {
        long intervalMs = Math.max(1, heartbeatInterval().toMillis());
        heartbeatScheduler =
                Executors.newSingleThreadScheduledExecutor(
                        runnable -> {
                            Thread thread = new Thread(runnable, "migration-lock-heartbeat");
                            thread.setDaemon(true);
                            return thread;
                        });
        heartbeatScheduler.scheduleAtFixedRate(
                this::heartbeat, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void stopHeartbeat() {
        if (heartbeatScheduler != null) {
            heartbeatScheduler.shutdownNow();
            heartbeatScheduler = null;
        }
    }

    private synchronized void heartbeat() {
        if (!held) {
            return;
        }
        try {
            renew();
        } catch (MigrationException e) {
            // The executor's own renewal before the next step fails on a lost lease.
            log.warn("Heartbeat could not renew migration lock {}", table, e);
        }
    }

    private static boolean isConstraintViolation(SQLException e) {
        return e.getSQLState() != null && e.getSQLState().startsWith("23");
    }

    private static String defaultOwner() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "unknown-host";
        }
        return ProcessHandle.current().pid() + "@" + host + "/" + UUID.randomUUID();
    }
}
