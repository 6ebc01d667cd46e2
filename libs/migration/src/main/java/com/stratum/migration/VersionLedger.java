package com.stratum.migration;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The ledger table inside the target datastore: one row per applied migration.
 *
 * <p>Reads are public. {@link #insert} and {@link #deleteByVersion} are package-private and only
 * called by {@link MigrationExecutor} inside the transaction that also runs the script, so the
 * ledger never gets ahead of or behind the schema.
 */
public class VersionLedger {

    private static final Logger log = LoggerFactory.getLogger(VersionLedger.class);

    private static final String COLUMNS = "id, version, name, checksum, applied_at, execution_time_ms";

    private final Connection connection;
    private final String table;

    /**
     * @param connection open connection; the caller owns its lifecycle
     * @param table ledger table name, already validated as a plain identifier
     */
    public VersionLedger(Connection connection, String table) {
        if (connection == null) {
            throw new IllegalArgumentException("connection must not be null");
        }
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("table must not be null or blank");
        }
        this.connection = connection;
        this.table = table;
    }

    public String table() {
        return table;
    }

    /** Creates the ledger table and its unique version index if they are missing. */
    public void ensureSchema() {
        try (Statement statement = connection.createStatement()) {
            statement.execute(
                    "CREATE TABLE IF NOT EXISTS "
                            + table
                            + " ("
                            + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                            + "version BIGINT NOT NULL, "
                            + "name VARCHAR(255) NOT NULL, "
                            + "checksum VARCHAR(64) NOT NULL, "
                            + "applied_at TIMESTAMP NOT NULL, "
                            + "execution_time_ms BIGINT NOT NULL"
                            + ")");
            statement.execute(
                    "CREATE UNIQUE INDEX IF NOT EXISTS idx_"
                            + table
                            + "_version ON "
                            + table
                            + " (version)");
        } catch (SQLException e) {
            throw new MigrationException("Unable to create ledger table " + table, e);
        }
    }

    /**
     * Whether the ledger table exists in the connection's current catalog and schema. A table of
     * the same name in another schema does not count.
     */
    public boolean exists() {
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(table);
        candidates.add(table.toUpperCase(Locale.ROOT));
        candidates.add(table.toLowerCase(Locale.ROOT));
        try {
            DatabaseMetaData metaData = connection.getMetaData();
            String escape = metaData.getSearchStringEscape();
            String catalog = connection.getCatalog();
            String schema = connection.getSchema();
            String schemaPattern = schema == null ? null : escapePattern(schema, escape);
            for (String candidate : candidates) {
                // No type filter: drivers disagree on "TABLE" versus "BASE TABLE".
                try (ResultSet tables =
                        metaData.getTables(
                                catalog, schemaPattern, escapePattern(candidate, escape), null)) {
                    while (tables.next()) {
                        // Drivers without an escape string still match '_' as a wildcard.
                        if (candidate.equals(tables.getString("TABLE_NAME"))) {
                            return true;
                        }
                    }
                }
            }
            return false;
        } catch (SQLException e) {
            throw new MigrationException("Unable to inspect ledger table " + table, e);
        }
    }

    /**
     * All applied migrations in ascending version order. Returns an empty list, without creating
     * anything, when the ledger table does not exist yet.
     */
    public List<LedgerEntry> listApplied() {
        if (!exists()) {
            log.debug("Ledger table {} does not exist yet", table);
            return List.of();
        }
        String sql = "SELECT " + COLUMNS + " FROM " + table + " ORDER BY version";
        try (PreparedStatement statement = connection.prepareStatement(sql);
                ResultSet rows = statement.executeQuery()) {
            List<LedgerEntry> entries = new ArrayList<>();
            while (rows.next()) {
                entries.add(toEntry(rows));
            }
            return List.copyOf(entries);
        } catch (SQLException e) {
            throw new MigrationException("Unable to read ledger table " + table, e);
        }
    }

    public Optional<LedgerEntry> findByVersion(long version) {
        String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE version = ?";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, version);
            try (ResultSet rows = statement.executeQuery()) {
                return rows.next() ? Optional.of(toEntry(rows)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new MigrationException(
                    "Unable to read ledger entry for version " + version, e);
        }
    }

    void insert(LedgerEntry entry) throws SQLException {
        try (PreparedStatement statement =
                connection.prepareStatement(
                        "INSERT INTO "
                                + table
                                + " (version, name, checksum, applied_at, execution_time_ms)"
                                + " VALUES (?, ?, ?, ?, ?)")) {
            statement.setLong(1, entry.version());
            statement.setString(2, entry.name());
            statement.setString(3, entry.checksum());
            statement.setTimestamp(4, Timestamp.from(entry.appliedAt()));
            statement.setLong(5, entry.executionTimeMs());
            statement.executeUpdate();
        }
    }

    int deleteByVersion(long version) throws SQLException {
        try (PreparedStatement statement =
                connection.prepareStatement("DELETE FROM " + table + " WHERE version = ?")) {
            statement.setLong(1, version);
            return statement.executeUpdate();
        }
    }

    /** Escapes the LIKE wildcards {@code _} and {@code %} in a metadata name pattern. */
    static String escapePattern(String name, String escape) {
        if (escape == null || escape.isEmpty()) {
            return name;
        }
        return name.replace(escape, escape + escape)
                .replace("_", escape + "_")
                .replace("%", escape + "%");
    }

    private static LedgerEntry toEntry(ResultSet row) throws SQLException {
        return new LedgerEntry(
                row.getLong("id"),
                row.getLong("version"),
                row.getString("name"),
                row.getString("checksum"),
                row.getTimestamp("applied_at").toInstant(),
                row.getLong("execution_time_ms"));
    }
}
