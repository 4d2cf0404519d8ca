package io.serverpulse.config;

import io.serverpulse.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Effective worker settings.
 *
 * <p>Values come from {@code serverpulse-settings.json} in the data root when present; every
 * missing or out-of-range field falls back to the default below. Durations are kept in
 * milliseconds in the file and exposed as {@link Duration}.
 */
public record WorkerSettings(
        String serviceName,
        String javaProcessName,
        String processMatch,
        long tickMs,
        long metricIntervalMs,
        long ingestIntervalMs,
        long cleanupIntervalMs,
        long ingestLookbackMs,
        long backfillWindowMs,
        long performanceRetentionMs,
        long eventRetentionMs,
        int metricTailLines,
        long ingestQueryTimeoutMs,
        long backfillQueryTimeoutMs,
        long metricQueryTimeoutMs,
        long probeTimeoutMs,
        long gracefulShutdownMs
) {
    public static final String DEFAULT_SERVICE_NAME = "hytale";
    public static final String DEFAULT_JAVA_PROCESS_NAME = "java";
    public static final String DEFAULT_PROCESS_MATCH = "HytaleServer.jar";
    public static final long DEFAULT_TICK_MS = 1_000L;
    public static final long DEFAULT_METRIC_INTERVAL_MS = 5_000L;
    public static final long DEFAULT_INGEST_INTERVAL_MS = 10_000L;
    public static final long DEFAULT_CLEANUP_INTERVAL_MS = 60L * 60L * 1000L;
    public static final long DEFAULT_INGEST_LOOKBACK_MS = Duration.ofDays(3).toMillis();
    public static final long DEFAULT_BACKFILL_WINDOW_MS = Duration.ofDays(7).toMillis();
    public static final long DEFAULT_PERFORMANCE_RETENTION_MS = Duration.ofHours(24).toMillis();
    public static final long DEFAULT_EVENT_RETENTION_MS = Duration.ofDays(7).toMillis();
    public static final int DEFAULT_METRIC_TAIL_LINES = 200;
    public static final long DEFAULT_INGEST_QUERY_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_BACKFILL_QUERY_TIMEOUT_MS = 60_000L;
    public static final long DEFAULT_METRIC_QUERY_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_PROBE_TIMEOUT_MS = 10_000L;
    public static final long DEFAULT_GRACEFUL_SHUTDOWN_MS = 15_000L;

    public static WorkerSettings defaults() {
        return new WorkerSettings(
                DEFAULT_SERVICE_NAME,
                DEFAULT_JAVA_PROCESS_NAME,
                DEFAULT_PROCESS_MATCH,
                DEFAULT_TICK_MS,
                DEFAULT_METRIC_INTERVAL_MS,
                DEFAULT_INGEST_INTERVAL_MS,
                DEFAULT_CLEANUP_INTERVAL_MS,
                DEFAULT_INGEST_LOOKBACK_MS,
                DEFAULT_BACKFILL_WINDOW_MS,
                DEFAULT_PERFORMANCE_RETENTION_MS,
                DEFAULT_EVENT_RETENTION_MS,
                DEFAULT_METRIC_TAIL_LINES,
                DEFAULT_INGEST_QUERY_TIMEOUT_MS,
                DEFAULT_BACKFILL_QUERY_TIMEOUT_MS,
                DEFAULT_METRIC_QUERY_TIMEOUT_MS,
                DEFAULT_PROBE_TIMEOUT_MS,
                DEFAULT_GRACEFUL_SHUTDOWN_MS
        );
    }

    /**
     * Reads the settings file, or returns the defaults when it does not exist.
     *
     * @throws IOException when the file exists but cannot be read or parsed
     */
    public static WorkerSettings load(Path file) throws IOException {
        WorkerSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        SettingsFile parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
        return fromFile(parsed, defaults);
    }

    static WorkerSettings fromFile(SettingsFile file, WorkerSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long tick = sanitizeLong(file.tickMs(), defaults.tickMs(), 10L);
        return new WorkerSettings(
                sanitizeText(file.serviceName(), defaults.serviceName()),
                sanitizeText(file.javaProcessName(), defaults.javaProcessName()),
                sanitizeText(file.processMatch(), defaults.processMatch()),
                tick,
                sanitizeLong(file.metricIntervalMs(), defaults.metricIntervalMs(), tick),
                sanitizeLong(file.ingestIntervalMs(), defaults.ingestIntervalMs(), tick),
                sanitizeLong(file.cleanupIntervalMs(), defaults.cleanupIntervalMs(), tick),
                sanitizeLong(file.ingestLookbackMs(), defaults.ingestLookbackMs(), 60_000L),
                sanitizeLong(file.backfillWindowMs(), defaults.backfillWindowMs(), 60_000L),
                sanitizeLong(file.performanceRetentionMs(), defaults.performanceRetentionMs(), 60_000L),
                sanitizeLong(file.eventRetentionMs(), defaults.eventRetentionMs(), 60_000L),
                sanitizeInt(file.metricTailLines(), defaults.metricTailLines(), 1),
                sanitizeLong(file.ingestQueryTimeoutMs(), defaults.ingestQueryTimeoutMs(), 1_000L),
                sanitizeLong(file.backfillQueryTimeoutMs(), defaults.backfillQueryTimeoutMs(), 1_000L),
                sanitizeLong(file.metricQueryTimeoutMs(), defaults.metricQueryTimeoutMs(), 1_000L),
                sanitizeLong(file.probeTimeoutMs(), defaults.probeTimeoutMs(), 1_000L),
                sanitizeLong(file.gracefulShutdownMs(), defaults.gracefulShutdownMs(), 0L)
        );
    }

    public Duration tick() {
        return Duration.ofMillis(tickMs);
    }

    public Duration metricInterval() {
        return Duration.ofMillis(metricIntervalMs);
    }

    public Duration ingestInterval() {
        return Duration.ofMillis(ingestIntervalMs);
    }

    public Duration cleanupInterval() {
        return Duration.ofMillis(cleanupIntervalMs);
    }

    public Duration ingestLookback() {
        return Duration.ofMillis(ingestLookbackMs);
    }

    public Duration backfillWindow() {
        return Duration.ofMillis(backfillWindowMs);
    }

    public Duration performanceRetention() {
        return Duration.ofMillis(performanceRetentionMs);
    }

    public Duration eventRetention() {
        return Duration.ofMillis(eventRetentionMs);
    }

    public Duration ingestQueryTimeout() {
        return Duration.ofMillis(ingestQueryTimeoutMs);
    }

    public Duration backfillQueryTimeout() {
        return Duration.ofMillis(backfillQueryTimeoutMs);
    }

    public Duration metricQueryTimeout() {
        return Duration.ofMillis(metricQueryTimeoutMs);
    }

    public Duration probeTimeout() {
        return Duration.ofMillis(probeTimeoutMs);
    }

    public Duration gracefulShutdown() {
        return Duration.ofMillis(gracefulShutdownMs);
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static String sanitizeText(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value.trim();
    }

    record SettingsFile(
            String serviceName,
            String javaProcessName,
            String processMatch,
            Long tickMs,
            Long metricIntervalMs,
            Long ingestIntervalMs,
            Long cleanupIntervalMs,
            Long ingestLookbackMs,
            Long backfillWindowMs,
            Long performanceRetentionMs,
            Long eventRetentionMs,
            Integer metricTailLines,
            Long ingestQueryTimeoutMs,
            Long backfillQueryTimeoutMs,
            Long metricQueryTimeoutMs,
            Long probeTimeoutMs,
            Long gracefulShutdownMs
    ) {
    }
}
