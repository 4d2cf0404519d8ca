package io.serverpulse.retention;

import io.serverpulse.storage.Database;
import io.serverpulse.storage.PerformanceStore;
import io.serverpulse.storage.PlayerStore;
import io.serverpulse.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Ages out performance samples and event log rows, each against its own horizon. The two deletes
 * are independent: a failure in one is logged and the other still runs.
 */
public final class RetentionPruner {
    private static final Logger log = LoggerFactory.getLogger(RetentionPruner.class);

    private final Database database;
    private final PerformanceStore performance;
    private final PlayerStore players;
    private final Clock clock;
    private final Duration performanceRetention;
    private final Duration eventRetention;

    public RetentionPruner(
            Database database,
            PerformanceStore performance,
            PlayerStore players,
            Clock clock,
            Duration performanceRetention,
            Duration eventRetention
    ) {
        this.database = database;
        this.performance = performance;
        this.players = players;
        this.clock = clock;
        this.performanceRetention = performanceRetention;
        this.eventRetention = eventRetention;
    }

    public PruneOutcome prune() {
        Instant now = clock.instant();
        int samples = 0;
        try {
            samples = performance.pruneOlderThan(now.minus(performanceRetention).toEpochMilli());
        } catch (StorageException e) {
            log.warn("Cleanup: performance prune failed, retrying next cleanup", e);
        }
        int events = 0;
        try {
            events = players.pruneEventsOlderThan(now.minus(eventRetention).toEpochMilli());
        } catch (StorageException e) {
            log.warn("Cleanup: player event prune failed, retrying next cleanup", e);
        }
        if (samples == 0 && events == 0) {
            log.debug("Cleanup: nothing older than retention");
            return new PruneOutcome(0, 0, false);
        }
        log.info("Cleanup: removed {} performance samples, {} player events", samples, events);
        boolean compacted = false;
        try {
            compacted = database.compactionHint();
        } catch (StorageException e) {
            log.warn("Cleanup: WAL checkpoint failed, leaving it to SQLite", e);
        }
        return new PruneOutcome(samples, events, compacted);
    }

    public record PruneOutcome(int performanceSamplesDeleted, int eventsDeleted, boolean compacted) {
    }
}
