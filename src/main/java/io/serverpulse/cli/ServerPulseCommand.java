package io.serverpulse.cli;

import io.serverpulse.config.ServerPulseConfig;
import io.serverpulse.runtime.Scheduler;
import io.serverpulse.runtime.ServerPulseRuntime;
import io.serverpulse.runtime.Sleeper;
import io.serverpulse.runtime.StartupException;
import io.serverpulse.runtime.StopSignal;
import io.serverpulse.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Command(
        name = "serverpulse",
        mixinStandardHelpOptions = true,
        description = "Game server telemetry worker: player sessions and performance samples in SQLite",
        subcommands = {
                ServerPulseCommand.InitCommand.class,
                ServerPulseCommand.RunCommand.class,
                ServerPulseCommand.BackfillCommand.class,
                ServerPulseCommand.IngestCommand.class,
                ServerPulseCommand.SampleCommand.class,
                ServerPulseCommand.PruneCommand.class,
                ServerPulseCommand.PlayersCommand.class,
                ServerPulseCommand.EventsCommand.class,
                ServerPulseCommand.PerformanceCommand.class,
                ServerPulseCommand.CheckpointCommand.class,
                ServerPulseCommand.StatusCommand.class,
                ServerPulseCommand.SchemaMigrationsCommand.class
        }
)
public final class ServerPulseCommand implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ServerPulseCommand.class);

    @Option(names = {"--root"}, description = "Data root directory (database and settings)", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | run | backfill | ingest | sample | prune | players | events | performance | checkpoint | status | schema-migrations");
    }

    ServerPulseRuntime runtime() throws StartupException {
        return ServerPulseRuntime.open(ServerPulseConfig.fromRoot(root));
    }

    /**
     * Opens the runtime and initializes the schema, for one-shot commands.
     */
    ServerPulseRuntime initializedRuntime() throws StartupException {
        ServerPulseRuntime runtime = runtime();
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Create the data directory and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        ServerPulseCommand parent;

        @Override
        public Integer call() throws Exception {
            try (ServerPulseRuntime runtime = parent.initializedRuntime()) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("root", runtime.config().rootDir().toString());
                out.put("database", runtime.config().dbFile().toString());
                out.put("settings", runtime.settings());
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }

    @Command(name = "run", description = "Run the worker until SIGTERM/SIGINT")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        ServerPulseCommand parent;

        @Override
        public Integer call() throws Exception {
            ServerPulseRuntime runtime;
            try {
                runtime = parent.runtime();
            } catch (StartupException e) {
                System.err.println(e.getMessage());
                return 1;
            }
            StopSignal stop = new StopSignal();
            Scheduler scheduler = runtime.newScheduler(stop, System::nanoTime, Sleeper.threadSleeper());
            Duration graceful = runtime.settings().gracefulShutdown();
            AtomicInteger exitCode = new AtomicInteger(1);
            CountDownLatch finished = new CountDownLatch(1);
            // A signal-triggered JVM exit reports 128+signal; once the loop has stopped cleanly
            // the hook halts with the loop's own exit code instead.
            Thread hook = new Thread(() -> {
                scheduler.requestStop();
                try {
                    if (finished.await(graceful.toMillis(), TimeUnit.MILLISECONDS)) {
                        Runtime.getRuntime().halt(exitCode.get());
                    }
                    System.err.println("Worker did not stop within " + graceful);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
            }, "serverpulse-shutdown-hook");
            Runtime.getRuntime().addShutdownHook(hook);

            int code = 1;
            try {
                scheduler.run();
                code = 0;
            } catch (StartupException e) {
                System.err.println(e.getMessage());
            } finally {
                exitCode.set(code);
                finished.countDown();
                releaseHook(hook);
            }
            return code;
        }

        private static void releaseHook(Thread hook) {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM shutdown already under way, exit code is set by the shutdown hook");
            }
        }
    }

    @Command(name = "backfill", description = "Run the wide initial player scan once")
    static final class BackfillCommand implements Callable<Integer> {
        @ParentCommand
        ServerPulseCommand parent;

        @Override
        public Integer call() throws Exception {
            try (ServerPulseRuntime runtime = parent.initializedRuntime()) {
                System.out.println(Jsons.toJson(runtime.backfill()));
                return 0;
            }
        }
    }

    @Command(name = "ingest", description = "Run one incremental ingestion pass from the checkpoint")
    static final class IngestCommand implements Callable<Integer> {
        @ParentCommand
        ServerPulseCommand parent;

        @Override
        public Integer call() throws Exception {
            try (ServerPulseRuntime runtime = parent.initializedRuntime()) {
                System.out.println(Jsons.toJson(runtime.ingest()));
                return 0;
            }
        }
    }

    @Command(name = "sample", description = "Record one performance sample")
    static final class SampleCommand implements Callable<Integer> {
        @ParentCommand
        ServerPulseCommand parent;

        @Override
        public Integer call() throws Exception {
            try (ServerPulseRuntime runtime = parent.initializedRuntime()) {
                System.out.println(Jsons.toJson(runtime.sample()));
                return 0;
            }
        }
    }

    @Command(name = "prune", description = "Delete samples and events older than their retention")
    static final class PruneCommand implements Callable<Integer> {
        @ParentCommand
        ServerPulseCommand parent;

        @Override
        public Integer call() throws Exception {
            try (ServerPulseRuntime runtime = parent.initializedRuntime()) {
                System.out.println(Jsons.toJson(runtime.prune()));
                return 0;
            }
        }
    }

    @Command(name = "players", description = "List known players")
    static final class PlayersCommand implements Callable<Integer> {
        @ParentCommand
        ServerPulseCommand parent;

        @Option(names = {"--online"}, defaultValue = "false", description = "Only players currently online")
        boolean online;

        @Override
        public Integer call() throws Exception {
            try (ServerPulseRuntime runtime = parent.initializedRuntime()) {
                System.out.println(Jsons.toJson(runtime.players(online)));
                return 0;
            }
        }
    }

    @Command(name = "events", description = "Show the most recent join/leave events")
    static final class EventsCommand implements Callable<Integer> {
        @ParentCommand
        ServerPulseCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() throws Exception {
            try (ServerPulseRuntime runtime = parent.initializedRuntime()) {
                System.out.println(Jsons.toJson(runtime.recentEvents(limit)));
                return 0;
            }
        }
    }

    @Command(name = "performance", description = "Show the most recent performance samples")
    static final class PerformanceCommand implements Callable<Integer> {
        @ParentCommand
        ServerPulseCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() throws Exception {
            try (ServerPulseRuntime runtime = parent.initializedRuntime()) {
                System.out.println(Jsons.toJson(runtime.recentPerformance(limit)));
                return 0;
            }
        }
    }

    @Command(name = "checkpoint", description = "Show the ingestion checkpoint")
    static final class CheckpointCommand implements Callable<Integer> {
        @ParentCommand
        ServerPulseCommand parent;

        @Override
        public Integer call() throws Exception {
            try (ServerPulseRuntime runtime = parent.initializedRuntime()) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("checkpoint", runtime.checkpoint().orElse(null));
                System.out.println(Jsons.toJson(out));
                return 0;
            }
        }
    }

    @Command(name = "status", description = "Show row counts and the checkpoint")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        ServerPulseCommand parent;

        @Override
        public Integer call() throws Exception {
            try (ServerPulseRuntime runtime = parent.initializedRuntime()) {
                System.out.println(Jsons.toJson(runtime.status()));
                return 0;
            }
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        ServerPulseCommand parent;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows to print")
        int limit;

        @Override
        public Integer call() throws Exception {
            try (ServerPulseRuntime runtime = parent.initializedRuntime()) {
                System.out.println(Jsons.toJson(runtime.schemaMigrations(limit)));
                return 0;
            }
        }
    }
}
