package io.serverpulse.runtime;

import io.serverpulse.config.ServerPulseConfig;
import io.serverpulse.config.WorkerSettings;
import io.serverpulse.logsource.LogSource;
import io.serverpulse.probe.ResourceUsage;
import io.serverpulse.testing.ManualClock;
import io.serverpulse.testing.ScriptedLogSource;
import io.serverpulse.testing.TestDirs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

final class ServerPulseRuntimeTest {
    private static final Instant NOW = Instant.parse("2024-01-05T00:00:00Z");

    @Test
    void daemonLoopBackfillsSamplesAndIngests() throws Exception {
        Path root = Files.createTempDirectory("serverpulse-test-runtime-loop-");
        try {
            ServerPulseConfig config = ServerPulseConfig.fromRoot(root.toString());
            ManualClock clock = new ManualClock(NOW);
            ScriptedLogSource logs = new ScriptedLogSource()
                    .windowLines(List.of(
                            "2024-01-04T10:00:00 Adding player 'Alice' to world 'Overworld' at location (0) (abc-123)",
                            "2024-01-04T10:30:00 Adding player 'Bob' to world 'Overworld' at location (0) (def-456)",
                            "2024-01-04T11:00:00 Removing player 'Bob' (def-456)"
                    ))
                    .tailLines(List.of("2024-01-04T23:59:59 Setting TPS of world default to 20"));
            ServerPulseRuntime runtime = new ServerPulseRuntime(
                    config,
                    WorkerSettings.defaults(),
                    logs,
                    () -> OptionalLong.of(845L),
                    pid -> Optional.of(new ResourceUsage(12.0, 5.0, 204_800L)),
                    clock
            );
            StopSignal stop = new StopSignal();
            AtomicLong nanos = new AtomicLong();
            AtomicInteger sleeps = new AtomicInteger();
            Sleeper sleeper = duration -> {
                nanos.addAndGet(duration.toNanos());
                clock.advance(duration);
                if (sleeps.incrementAndGet() >= 12) {
                    stop.request();
                }
            };

            Scheduler scheduler = runtime.newScheduler(stop, nanos::get, sleeper);
            scheduler.run();

            Assertions.assertEquals(SchedulerState.STOPPED, scheduler.state());
            Assertions.assertEquals(List.of("metrics", "ingest", "cleanup"),
                    scheduler.tasks().stream().map(ScheduledTask::name).toList());
            Assertions.assertEquals(3L, scheduler.tasks().get(0).runs());
            Assertions.assertEquals(2L, scheduler.tasks().get(1).runs());
            Assertions.assertEquals(1L, scheduler.tasks().get(2).runs());
            Assertions.assertTrue(scheduler.tasks().stream().allMatch(t -> t.failures() == 0L));

            try (ServerPulseRuntime reader = new ServerPulseRuntime(config, WorkerSettings.defaults(),
                    logs, OptionalLong::empty, pid -> Optional.empty(), clock)) {
                ServerPulseRuntime.StatusView status = reader.status();
                Assertions.assertEquals(2, status.players());
                Assertions.assertEquals(1, status.playersOnline());
                Assertions.assertEquals(3, status.events());
                Assertions.assertEquals(3, status.performanceSamples());
                Assertions.assertEquals("2024-01-04T11:00:00", status.checkpoint());
                Assertions.assertEquals(1_800L, reader.player("def-456").orElseThrow().cumulativePlaytimeSeconds());
                Assertions.assertEquals(20, reader.recentPerformance(1).get(0).tps());
                Assertions.assertEquals(2, reader.schemaMigrations(10).size());
            }
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void malformedSettingsFailStartup() throws Exception {
        Path root = Files.createTempDirectory("serverpulse-test-runtime-settings-");
        try {
            ServerPulseConfig config = ServerPulseConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), "[1, 2", StandardCharsets.UTF_8);

            Assertions.assertThrows(StartupException.class, () -> ServerPulseRuntime.open(config));
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void openUsesSettingsFromDataRoot() throws Exception {
        Path root = Files.createTempDirectory("serverpulse-test-runtime-open-");
        try {
            ServerPulseConfig config = ServerPulseConfig.fromRoot(root.toString());
            Files.writeString(config.settingsFile(), "{\"serviceName\":\"lobby\",\"tickMs\":500}", StandardCharsets.UTF_8);

            try (ServerPulseRuntime runtime = ServerPulseRuntime.open(config)) {
                Assertions.assertEquals("lobby", runtime.settings().serviceName());
                Assertions.assertEquals(Duration.ofMillis(500), runtime.settings().tick());
            }
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }

    @Test
    void failedBackfillWriteDoesNotStopStartup() throws Exception {
        Path root = Files.createTempDirectory("serverpulse-test-runtime-backfill-");
        try {
            ServerPulseConfig config = ServerPulseConfig.fromRoot(root.toString());
            ManualClock clock = new ManualClock(NOW);
            AtomicInteger queries = new AtomicInteger();
            LogSource logs = query -> {
                if (queries.incrementAndGet() == 1) {
                    try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + config.dbFile());
                         Statement st = c.createStatement()) {
                        st.executeUpdate("DROP TABLE player_events");
                    } catch (SQLException e) {
                        throw new IllegalStateException(e);
                    }
                }
                return List.of("2024-01-04T10:00:00 Adding player 'Alice' to world 'Overworld' at location (0) (abc-123)");
            };
            ServerPulseRuntime runtime = new ServerPulseRuntime(
                    config, WorkerSettings.defaults(), logs, OptionalLong::empty, pid -> Optional.empty(), clock);
            StopSignal stop = new StopSignal();
            AtomicLong nanos = new AtomicLong();
            Sleeper sleeper = duration -> {
                nanos.addAndGet(duration.toNanos());
                stop.request();
            };

            Scheduler scheduler = runtime.newScheduler(stop, nanos::get, sleeper);
            Assertions.assertDoesNotThrow(scheduler::run);

            Assertions.assertEquals(SchedulerState.STOPPED, scheduler.state());
            ScheduledTask metrics = scheduler.tasks().get(0);
            Assertions.assertEquals(1L, metrics.runs());
            Assertions.assertEquals(0L, metrics.failures());
        } finally {
            TestDirs.deleteRecursively(root);
        }
    }
}
