package io.serverpulse.retention;

import io.serverpulse.config.ServerPulseConfig;
import io.serverpulse.model.PerformanceSample;
import io.serverpulse.model.PlayerEvent;
import io.serverpulse.storage.Database;
import io.serverpulse.storage.PerformanceStore;
import io.serverpulse.storage.PlayerStore;
import io.serverpulse.testing.ManualClock;
import io.serverpulse.testing.TestDirs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;

final class RetentionPrunerTest {
    private static final Instant NOW = Instant.parse("2024-01-10T00:00:00Z");

    @Test
    void removesOnlyRowsPastTheirHorizon() throws Exception {
        Path root = Files.createTempDirectory("serverpulse-test-retention-");
        try {
            Database db = new Database(ServerPulseConfig.fromRoot(root.toString()));
            db.init();
            PerformanceStore performance = new PerformanceStore(db);
            PlayerStore players = new PlayerStore(db);
            performance.insert(new PerformanceSample(NOW.minus(Duration.ofHours(25)), 20, null, null, null, null, 0));
            performance.insert(new PerformanceSample(NOW.minus(Duration.ofHours(23)), 20, null, null, null, null, 0));
            players.merge(PlayerEvent.join("2024-01-01T10:00:00", Instant.parse("2024-01-01T10:00:00Z"), "abc-123", "Alice", "Overworld"));
            players.merge(PlayerEvent.leave("2024-01-08T10:00:00", Instant.parse("2024-01-08T10:00:00Z"), "abc-123", "Alice"));
            RetentionPruner pruner = new RetentionPruner(
                    db, performance, players, new ManualClock(NOW), Duration.ofHours(24), Duration.ofDays(7));

            RetentionPruner.PruneOutcome outcome = pruner.prune();

            Assertions.assertEquals(1, outcome.performanceSamplesDeleted());
            Assertions.assertEquals(1, outcome.eventsDeleted());
            Assertions.assertEquals(1, performance.count());
            Assertions.assertEquals(1, players.countEvents());
            Assertions.assertEquals(1, players.countPlayers());
            Assertions.assertEquals(NOW.minus(Duration.ofHours(23)), performance.recent(1).get(0).timestamp());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void nothingToDeleteSkipsCompaction() throws Exception {
        Path root = Files.createTempDirectory("serverpulse-test-retention-noop-");
        try {
            Database db = new Database(ServerPulseConfig.fromRoot(root.toString()));
            db.init();
            PerformanceStore performance = new PerformanceStore(db);
            performance.insert(new PerformanceSample(NOW.minusSeconds(5), 20, null, null, null, null, 0));
            RetentionPruner pruner = new RetentionPruner(
                    db, performance, new PlayerStore(db), new ManualClock(NOW), Duration.ofHours(24), Duration.ofDays(7));

            RetentionPruner.PruneOutcome outcome = pruner.prune();

            Assertions.assertEquals(new RetentionPruner.PruneOutcome(0, 0, false), outcome);
            Assertions.assertEquals(1, performance.count());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void failedPerformanceDeleteStillPrunesEvents() throws Exception {
        Path root = Files.createTempDirectory("serverpulse-test-retention-partial-");
        try {
            Database db = new Database(ServerPulseConfig.fromRoot(root.toString()));
            db.init();
            PerformanceStore performance = new PerformanceStore(db);
            PlayerStore players = new PlayerStore(db);
            players.merge(PlayerEvent.join("2024-01-01T10:00:00", Instant.parse("2024-01-01T10:00:00Z"), "abc-123", "Alice", "Overworld"));
            try (Connection c = db.openConnection(); Statement st = c.createStatement()) {
                st.executeUpdate("DROP TABLE performance");
            }
            RetentionPruner pruner = new RetentionPruner(
                    db, performance, players, new ManualClock(NOW), Duration.ofHours(24), Duration.ofDays(7));

            RetentionPruner.PruneOutcome outcome = pruner.prune();

            Assertions.assertEquals(0, outcome.performanceSamplesDeleted());
            Assertions.assertEquals(1, outcome.eventsDeleted());
            Assertions.assertEquals(0, players.countEvents());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }
}
