package io.serverpulse.runtime;

import io.serverpulse.config.ServerPulseConfig;
import io.serverpulse.config.WorkerSettings;
import io.serverpulse.exec.CommandRunner;
import io.serverpulse.exec.ProcessCommandRunner;
import io.serverpulse.extract.PatternExtractor;
import io.serverpulse.logsource.JournalctlLogSource;
import io.serverpulse.logsource.LogSource;
import io.serverpulse.model.Checkpoint;
import io.serverpulse.model.EventLogEntry;
import io.serverpulse.model.PerformanceSample;
import io.serverpulse.model.PlayerRecord;
import io.serverpulse.probe.PidResolver;
import io.serverpulse.probe.PsResourceProbe;
import io.serverpulse.probe.ResourceProbe;
import io.serverpulse.probe.SystemdPidResolver;
import io.serverpulse.reconcile.StateReconciler;
import io.serverpulse.retention.RetentionPruner;
import io.serverpulse.sampler.MetricSampler;
import io.serverpulse.storage.CheckpointStore;
import io.serverpulse.storage.Database;
import io.serverpulse.storage.PerformanceStore;
import io.serverpulse.storage.PlayerStore;
import io.serverpulse.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Wires storage, log access and the three periodic jobs for one data root.
 *
 * <p>The CLI calls the one-shot operations directly; {@link #newScheduler} assembles the daemon
 * loop (startup = init + backfill, then metric, ingest and cleanup tasks).
 */
public final class ServerPulseRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ServerPulseRuntime.class);

    private final ServerPulseConfig config;
    private final WorkerSettings settings;
    private final Database database;
    private final PlayerStore playerStore;
    private final PerformanceStore performanceStore;
    private final CheckpointStore checkpointStore;
    private final StateReconciler reconciler;
    private final MetricSampler sampler;
    private final RetentionPruner pruner;

    public ServerPulseRuntime(ServerPulseConfig config, WorkerSettings settings) {
        this(config, settings, new ProcessCommandRunner(), Clock.systemUTC());
    }

    private ServerPulseRuntime(ServerPulseConfig config, WorkerSettings settings, CommandRunner runner, Clock clock) {
        this(
                config,
                settings,
                new JournalctlLogSource(settings.serviceName(), runner),
                new SystemdPidResolver(
                        settings.serviceName(),
                        settings.javaProcessName(),
                        settings.processMatch(),
                        runner,
                        settings.probeTimeout()
                ),
                new PsResourceProbe(runner, settings.probeTimeout()),
                clock
        );
    }

    public ServerPulseRuntime(
            ServerPulseConfig config,
            WorkerSettings settings,
            LogSource logSource,
            PidResolver pidResolver,
            ResourceProbe resourceProbe,
            Clock clock
    ) {
        this.config = config;
        this.settings = settings;
        this.database = new Database(config);
        this.playerStore = new PlayerStore(database);
        this.performanceStore = new PerformanceStore(database);
        this.checkpointStore = new CheckpointStore(database);
        PatternExtractor extractor = new PatternExtractor();
        this.reconciler = new StateReconciler(
                logSource,
                extractor,
                playerStore,
                checkpointStore,
                clock,
                settings.ingestLookback(),
                settings.ingestQueryTimeout(),
                settings.backfillWindow(),
                settings.backfillQueryTimeout()
        );
        this.sampler = new MetricSampler(
                logSource,
                extractor,
                pidResolver,
                resourceProbe,
                playerStore,
                performanceStore,
                clock,
                settings.metricTailLines(),
                settings.metricQueryTimeout()
        );
        this.pruner = new RetentionPruner(
                database,
                performanceStore,
                playerStore,
                clock,
                settings.performanceRetention(),
                settings.eventRetention()
        );
    }

    /**
     * Loads settings from the data root and builds a runtime against the host's journal and
     * process table.
     */
    public static ServerPulseRuntime open(ServerPulseConfig config) throws StartupException {
        WorkerSettings settings;
        try {
            settings = WorkerSettings.load(config.settingsFile());
        } catch (IOException e) {
            throw new StartupException("Failed to read settings " + config.settingsFile(), e);
        }
        return new ServerPulseRuntime(config, settings);
    }

    public ServerPulseConfig config() {
        return config;
    }

    public WorkerSettings settings() {
        return settings;
    }

    public void init() {
        database.init();
    }

    public StateReconciler.BackfillOutcome backfill() {
        return reconciler.backfill();
    }

    public StateReconciler.IngestOutcome ingest() {
        return reconciler.ingest();
    }

    public MetricSampler.SampleOutcome sample() {
        return sampler.sample();
    }

    public RetentionPruner.PruneOutcome prune() {
        return pruner.prune();
    }

    public List<PlayerRecord> players(boolean onlineOnly) {
        return playerStore.listPlayers(onlineOnly);
    }

    public Optional<PlayerRecord> player(String playerId) {
        return playerStore.findPlayer(playerId);
    }

    public List<EventLogEntry> recentEvents(int limit) {
        return playerStore.recentEvents(limit);
    }

    public List<PerformanceSample> recentPerformance(int limit) {
        return performanceStore.recent(limit);
    }

    public Optional<Checkpoint> checkpoint() {
        return checkpointStore.read();
    }

    public List<Database.SchemaMigrationRow> schemaMigrations(int limit) {
        return database.listSchemaMigrations(limit);
    }

    public StatusView status() {
        return new StatusView(
                config.dbFile().toString(),
                playerStore.countPlayers(),
                playerStore.countOnline(),
                playerStore.countEvents(),
                performanceStore.count(),
                checkpointStore.read().map(Checkpoint::timestamp).orElse(null)
        );
    }

    /**
     * Builds the daemon loop. Startup initializes the schema and runs the backfill; the shutdown
     * action closes storage.
     */
    public Scheduler newScheduler(StopSignal stopSignal, LongSupplier nanoTime, Sleeper sleeper) {
        List<ScheduledTask> tasks = List.of(
                new ScheduledTask("metrics", settings.metricInterval(), this::sample),
                new ScheduledTask("ingest", settings.ingestInterval(), this::ingest),
                new ScheduledTask("cleanup", settings.cleanupInterval(), this::prune)
        );
        return new Scheduler(
                this::startup,
                tasks,
                this::close,
                stopSignal,
                settings.tick(),
                nanoTime,
                sleeper
        );
    }

    /**
     * Daemon startup. Schema failures are fatal; a failed backfill write is logged and skipped.
     */
    void startup() {
        init();
        try {
            backfill();
        } catch (StorageException e) {
            log.warn("Initial player sync failed, continuing without it", e);
        }
    }

    @Override
    public void close() {
        database.close();
    }

    public record StatusView(
            String database,
            int players,
            int playersOnline,
            int events,
            int performanceSamples,
            String checkpoint
    ) {
    }
}
