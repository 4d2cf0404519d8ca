package io.serverpulse.storage;

import io.serverpulse.config.ServerPulseConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * SQLite file holding players, the event log, performance samples and the ingestion cursor.
 *
 * <p>Table and column names are shared with the dashboard, which reads the file directly.
 * Every operation opens its own short-lived connection; {@link #close()} rejects further use.
 */
public final class Database implements AutoCloseable {
    private static final String MIGRATION_SCHEMA_VERSION = "serverpulse.schema.migration.v1";
    private static final int BUSY_TIMEOUT_MS = 5_000;

    private final ServerPulseConfig config;
    private final String jdbcUrl;
    private volatile boolean closed;

    public Database(ServerPulseConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    /**
     * Creates the data directory, schema and indexes, applies pending migrations and validates
     * pragmas. Safe to run on every start.
     */
    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        if (closed) {
            throw new SQLException("database is closed: " + config.dbFile());
        }
        Properties props = new Properties();
        props.setProperty("synchronous", "NORMAL");
        props.setProperty("busy_timeout", Integer.toString(BUSY_TIMEOUT_MS));
        return DriverManager.getConnection(jdbcUrl, props);
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Asks SQLite to fold the WAL back into the main file without waiting on readers.
     *
     * @return true when the checkpoint ran to completion
     */
    public boolean compactionHint() {
        try (Connection conn = openConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA wal_checkpoint(PASSIVE)")) {
            // columns: busy, log frames, checkpointed frames
            return rs.next() && rs.getInt(1) == 0;
        } catch (SQLException e) {
            throw new StorageException("WAL checkpoint failed", e);
        }
    }

    @Override
    public void close() {
        closed = true;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new StorageException("Failed to initialize data directory " + config.rootDir(), e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS players (
                        uuid TEXT PRIMARY KEY,
                        name TEXT NOT NULL,
                        online INTEGER NOT NULL DEFAULT 0,
                        last_login TEXT,
                        last_login_ms INTEGER,
                        last_logout TEXT,
                        world TEXT,
                        total_playtime_seconds INTEGER NOT NULL DEFAULT 0,
                        playtime_counted_through_ms INTEGER
                    )
                    """);
            ensurePlayerColumns(conn);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS performance (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        timestamp TEXT NOT NULL,
                        sampled_at_ms INTEGER,
                        tps INTEGER,
                        cpu_percent REAL,
                        ram_mb REAL,
                        ram_percent REAL,
                        view_radius INTEGER,
                        players_online INTEGER NOT NULL DEFAULT 0
                    )
                    """);
            ensurePerformanceColumns(conn);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS player_events (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        timestamp TEXT NOT NULL,
                        occurred_at_ms INTEGER,
                        uuid TEXT NOT NULL,
                        name TEXT NOT NULL,
                        event_type TEXT NOT NULL,
                        world TEXT
                    )
                    """);
            ensurePlayerEventColumns(conn);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS metadata (
                        key TEXT PRIMARY KEY,
                        value TEXT,
                        updated_at_ms INTEGER
                    )
                    """);
            ensureMetadataColumns(conn);

            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_perf_ts ON performance(timestamp)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_perf_sampled_at ON performance(sampled_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_events_ts ON player_events(timestamp)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_events_occurred_at ON player_events(occurred_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_players_online ON players(online)");
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize SQLite schema", e);
        }
    }

    private Set<String> columns(Connection conn, String table) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        return columns;
    }

    private void ensurePlayerColumns(Connection conn) throws SQLException {
        Set<String> columns = columns(conn, "players");
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("last_login_ms")) {
                st.execute("ALTER TABLE players ADD COLUMN last_login_ms INTEGER");
            }
            if (!columns.contains("total_playtime_seconds")) {
                st.execute("ALTER TABLE players ADD COLUMN total_playtime_seconds INTEGER NOT NULL DEFAULT 0");
            }
            if (!columns.contains("playtime_counted_through_ms")) {
                st.execute("ALTER TABLE players ADD COLUMN playtime_counted_through_ms INTEGER");
            }
        }
    }

    private void ensurePerformanceColumns(Connection conn) throws SQLException {
        Set<String> columns = columns(conn, "performance");
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("view_radius")) {
                st.execute("ALTER TABLE performance ADD COLUMN view_radius INTEGER");
            }
            if (!columns.contains("sampled_at_ms")) {
                st.execute("ALTER TABLE performance ADD COLUMN sampled_at_ms INTEGER");
            }
        }
    }

    private void ensurePlayerEventColumns(Connection conn) throws SQLException {
        Set<String> columns = columns(conn, "player_events");
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("occurred_at_ms")) {
                st.execute("ALTER TABLE player_events ADD COLUMN occurred_at_ms INTEGER");
            }
        }
    }

    private void ensureMetadataColumns(Connection conn) throws SQLException {
        Set<String> columns = columns(conn, "metadata");
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("updated_at_ms")) {
                st.execute("ALTER TABLE metadata ADD COLUMN updated_at_ms INTEGER");
            }
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261018_001_epoch_millis_columns",
                "Derive sampled_at_ms / occurred_at_ms for rows written before the columns existed",
                List.of(
                        "UPDATE performance SET sampled_at_ms = CAST(strftime('%s', timestamp) AS INTEGER) * 1000 "
                                + "WHERE sampled_at_ms IS NULL AND strftime('%s', timestamp) IS NOT NULL",
                        "UPDATE player_events SET occurred_at_ms = CAST(strftime('%s', timestamp) AS INTEGER) * 1000 "
                                + "WHERE occurred_at_ms IS NULL AND strftime('%s', timestamp) IS NOT NULL"
                )
        ));
        steps.add(new MigrationStep(
                "20261018_002_player_event_dedupe",
                "Collapse duplicate event log rows and make (timestamp, uuid, event_type) unique",
                List.of(
                        "DELETE FROM player_events WHERE id NOT IN "
                                + "(SELECT MIN(id) FROM player_events GROUP BY timestamp, uuid, event_type)",
                        "CREATE UNIQUE INDEX IF NOT EXISTS ux_events_identity ON player_events(timestamp, uuid, event_type)"
                )
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        String checksum = checksum(step);
        conn.setAutoCommit(false);
        try {
            try (Statement st = conn.createStatement()) {
                for (String sql : step.sql()) {
                    st.execute(sql);
                }
            }
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
                ps.setString(1, step.version());
                ps.setString(2, step.description());
                ps.setString(3, checksum);
                ps.setLong(4, Instant.now().toEpochMilli());
                ps.executeUpdate();
            }
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new StorageException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        int safeLimit = Math.max(1, limit);
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, safeLimit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
