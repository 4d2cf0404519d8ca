package io.serverpulse.storage;

import io.serverpulse.model.Checkpoint;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

/**
 * Singleton ingestion cursor, stored as the source text of the last merged event timestamp.
 */
public final class CheckpointStore {
    static final String KEY = "last_event_ts";

    private final Database database;

    public CheckpointStore(Database database) {
        this.database = database;
    }

    public Optional<Checkpoint> read() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT value,updated_at_ms FROM metadata WHERE key=?")) {
            ps.setString(1, KEY);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                String value = rs.getString("value");
                if (value == null || value.isBlank()) return Optional.empty();
                long updatedAtMs = rs.getLong("updated_at_ms");
                Instant updatedAt = rs.wasNull() ? null : Instant.ofEpochMilli(updatedAtMs);
                return Optional.of(new Checkpoint(value, updatedAt));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read checkpoint", e);
        }
    }

    public void write(String timestamp, Instant now) {
        String sql = """
                INSERT INTO metadata(key,value,updated_at_ms) VALUES(?,?,?)
                ON CONFLICT(key) DO UPDATE SET value=excluded.value, updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, KEY);
            ps.setString(2, timestamp);
            ps.setLong(3, now.toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to write checkpoint", e);
        }
    }
}
