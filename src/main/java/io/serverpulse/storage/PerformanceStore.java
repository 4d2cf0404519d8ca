package io.serverpulse.storage;

import io.serverpulse.model.PerformanceSample;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only performance history. Rows are never updated, only inserted and aged out.
 */
public final class PerformanceStore {
    private final Database database;

    public PerformanceStore(Database database) {
        this.database = database;
    }

    public long insert(PerformanceSample sample) {
        String sql = """
                INSERT INTO performance(timestamp,sampled_at_ms,tps,cpu_percent,ram_mb,ram_percent,view_radius,players_online)
                VALUES(?,?,?,?,?,?,?,?)
                """;
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, sample.timestamp().toString());
            ps.setLong(2, sample.timestamp().toEpochMilli());
            setNullableInt(ps, 3, sample.tps());
            setNullableDouble(ps, 4, sample.cpuPercent());
            setNullableDouble(ps, 5, sample.ramMb());
            setNullableDouble(ps, 6, sample.ramPercent());
            setNullableInt(ps, 7, sample.viewRadius());
            ps.setInt(8, sample.playersOnline());
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                return keys.next() ? keys.getLong(1) : -1L;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to insert performance sample", e);
        }
    }

    public List<PerformanceSample> recent(int limit) {
        String sql = """
                SELECT sampled_at_ms,tps,cpu_percent,ram_mb,ram_percent,view_radius,players_online
                FROM performance
                ORDER BY id DESC
                LIMIT ?
                """;
        List<PerformanceSample> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, Math.min(10_000, limit)));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new PerformanceSample(
                            Instant.ofEpochMilli(rs.getLong("sampled_at_ms")),
                            nullableInt(rs, "tps"),
                            nullableDouble(rs, "cpu_percent"),
                            nullableDouble(rs, "ram_mb"),
                            nullableDouble(rs, "ram_percent"),
                            nullableInt(rs, "view_radius"),
                            rs.getInt("players_online")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to read performance samples", e);
        }
    }

    public int count() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(1) FROM performance");
             ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getInt(1);
        } catch (SQLException e) {
            throw new StorageException("Failed to count performance samples", e);
        }
    }

    public int pruneOlderThan(long cutoffMs) {
        String sql = "DELETE FROM performance WHERE sampled_at_ms IS NOT NULL AND sampled_at_ms < ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, cutoffMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to prune performance samples", e);
        }
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private static void setNullableDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.REAL);
        } else {
            ps.setDouble(index, value);
        }
    }
}
