package io.serverpulse.storage;

import io.serverpulse.model.EventKind;
import io.serverpulse.model.EventLogEntry;
import io.serverpulse.model.PlayerEvent;
import io.serverpulse.model.PlayerRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public final class PlayerStore {
    private static final String JOIN_UPSERT = """
            INSERT INTO players(uuid,name,online,last_login,last_login_ms,world)
            VALUES(?,?,1,?,?,?)
            ON CONFLICT(uuid) DO UPDATE SET
                name=excluded.name,
                online=1,
                last_login=excluded.last_login,
                last_login_ms=excluded.last_login_ms,
                world=excluded.world
            """;
    private static final String SNAPSHOT_UPSERT = """
            INSERT INTO players(uuid,name,online,last_login,last_login_ms,last_logout,world)
            VALUES(?,?,?,?,?,?,?)
            ON CONFLICT(uuid) DO UPDATE SET
                name=excluded.name,
                online=excluded.online,
                last_login=COALESCE(excluded.last_login, players.last_login),
                last_login_ms=COALESCE(excluded.last_login_ms, players.last_login_ms),
                last_logout=COALESCE(excluded.last_logout, players.last_logout),
                world=COALESCE(excluded.world, players.world)
            """;
    private static final String EVENT_INSERT = """
            INSERT OR IGNORE INTO player_events(timestamp,occurred_at_ms,uuid,name,event_type,world)
            VALUES(?,?,?,?,?,?)
            """;

    private final Database database;

    public PlayerStore(Database database) {
        this.database = database;
    }

    /**
     * Applies one event to its player row and appends it to the event log, atomically.
     *
     * <p>A leave for an unknown player leaves the players table untouched but is still logged.
     * Playtime is only credited by a leave that is newer than the last leave already credited,
     * so replaying the same window never counts a session twice.
     */
    public MergeResult merge(PlayerEvent event) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                boolean playerChanged;
                long playtimeAdded = 0L;
                if (event.kind() == EventKind.JOIN) {
                    applyJoin(c, event);
                    playerChanged = true;
                } else {
                    LeaveOutcome leave = applyLeave(c, event);
                    playerChanged = leave.matched();
                    playtimeAdded = leave.playtimeAddedSeconds();
                }
                boolean recorded = recordEvent(c, event);
                c.commit();
                return new MergeResult(playerChanged, recorded, playtimeAdded);
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to merge " + event.kind() + " for " + event.playerId(), e);
        }
    }

    /**
     * Writes backfilled player snapshots (non-null values win over stored ones) and records the
     * events they were folded from, in one transaction.
     */
    public BackfillResult applyBackfill(Collection<PlayerSnapshot> snapshots, List<PlayerEvent> events) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(SNAPSHOT_UPSERT)) {
                for (PlayerSnapshot p : snapshots) {
                    ps.setString(1, p.playerId());
                    ps.setString(2, p.displayName());
                    ps.setInt(3, p.online() ? 1 : 0);
                    ps.setString(4, p.lastLogin());
                    setNullableLong(ps, 5, p.lastLoginMs());
                    ps.setString(6, p.lastLogout());
                    ps.setString(7, p.world());
                    ps.executeUpdate();
                }
                int recorded = 0;
                for (PlayerEvent event : events) {
                    if (recordEvent(c, event)) {
                        recorded++;
                    }
                }
                c.commit();
                return new BackfillResult(snapshots.size(), recorded);
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to apply backfill", e);
        }
    }

    public Optional<PlayerRecord> findPlayer(String playerId) {
        String sql = """
                SELECT uuid,name,online,last_login,last_logout,world,total_playtime_seconds
                FROM players WHERE uuid=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, playerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readPlayer(rs));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read player " + playerId, e);
        }
    }

    public List<PlayerRecord> listPlayers(boolean onlineOnly) {
        String sql = onlineOnly
                ? "SELECT uuid,name,online,last_login,last_logout,world,total_playtime_seconds FROM players WHERE online=1 ORDER BY name"
                : "SELECT uuid,name,online,last_login,last_logout,world,total_playtime_seconds FROM players ORDER BY online DESC, name";
        List<PlayerRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(readPlayer(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to list players", e);
        }
    }

    public int countOnline() {
        return count("SELECT COUNT(1) FROM players WHERE online=1");
    }

    public int countPlayers() {
        return count("SELECT COUNT(1) FROM players");
    }

    public int countEvents() {
        return count("SELECT COUNT(1) FROM player_events");
    }

    public List<EventLogEntry> recentEvents(int limit) {
        String sql = """
                SELECT id,timestamp,occurred_at_ms,uuid,name,event_type,world
                FROM player_events
                ORDER BY id DESC
                LIMIT ?
                """;
        List<EventLogEntry> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, Math.min(1000, limit)));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new EventLogEntry(
                            rs.getLong("id"),
                            rs.getString("timestamp"),
                            rs.getLong("occurred_at_ms"),
                            rs.getString("uuid"),
                            rs.getString("name"),
                            EventKind.fromStorage(rs.getString("event_type")),
                            rs.getString("world")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StorageException("Failed to read recent events", e);
        }
    }

    public int pruneEventsOlderThan(long cutoffMs) {
        String sql = "DELETE FROM player_events WHERE occurred_at_ms IS NOT NULL AND occurred_at_ms < ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, cutoffMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to prune player events", e);
        }
    }

    private void applyJoin(Connection c, PlayerEvent event) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(JOIN_UPSERT)) {
            ps.setString(1, event.playerId());
            ps.setString(2, event.displayName());
            ps.setString(3, event.timestamp());
            ps.setLong(4, event.occurredAt().toEpochMilli());
            ps.setString(5, event.world());
            ps.executeUpdate();
        }
    }

    private LeaveOutcome applyLeave(Connection c, PlayerEvent event) throws SQLException {
        boolean online;
        Long loginMs;
        Long countedThroughMs;
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT online,last_login_ms,playtime_counted_through_ms FROM players WHERE uuid=?")) {
            ps.setString(1, event.playerId());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return new LeaveOutcome(false, 0L);
                }
                online = rs.getInt("online") == 1;
                loginMs = nullableLong(rs, "last_login_ms");
                countedThroughMs = nullableLong(rs, "playtime_counted_through_ms");
            }
        }

        long leaveMs = event.occurredAt().toEpochMilli();
        long added = 0L;
        Long newCountedThrough = countedThroughMs;
        boolean newerThanCredited = countedThroughMs == null || leaveMs > countedThroughMs;
        if (online && loginMs != null && leaveMs >= loginMs && newerThanCredited) {
            added = (leaveMs - loginMs) / 1000L;
            newCountedThrough = leaveMs;
        }

        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE players SET
                    online=0,
                    last_logout=?,
                    total_playtime_seconds=total_playtime_seconds+?,
                    playtime_counted_through_ms=?
                WHERE uuid=?
                """)) {
            ps.setString(1, event.timestamp());
            ps.setLong(2, added);
            setNullableLong(ps, 3, newCountedThrough);
            ps.setString(4, event.playerId());
            ps.executeUpdate();
        }
        return new LeaveOutcome(true, added);
    }

    private boolean recordEvent(Connection c, PlayerEvent event) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(EVENT_INSERT)) {
            ps.setString(1, event.timestamp());
            ps.setLong(2, event.occurredAt().toEpochMilli());
            ps.setString(3, event.playerId());
            ps.setString(4, event.displayName());
            ps.setString(5, event.kind().storageValue());
            ps.setString(6, event.world());
            return ps.executeUpdate() == 1;
        }
    }

    private PlayerRecord readPlayer(ResultSet rs) throws SQLException {
        return new PlayerRecord(
                rs.getString("uuid"),
                rs.getString("name"),
                rs.getInt("online") == 1,
                rs.getString("last_login"),
                rs.getString("last_logout"),
                rs.getString("world"),
                rs.getLong("total_playtime_seconds")
        );
    }

    private int count(String sql) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getInt(1);
        } catch (SQLException e) {
            throw new StorageException("Failed count query", e);
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, value);
        }
    }

    private record LeaveOutcome(boolean matched, long playtimeAddedSeconds) {}

    public record MergeResult(boolean playerChanged, boolean recorded, long playtimeAddedSeconds) {}

    public record BackfillResult(int playersWritten, int eventsRecorded) {}

    /**
     * Player state folded in memory during backfill. Null fields keep whatever is stored.
     */
    public record PlayerSnapshot(
            String playerId,
            String displayName,
            boolean online,
            String lastLogin,
            Long lastLoginMs,
            String lastLogout,
            String world
    ) {}
}
