package io.serverpulse.sampler;

import io.serverpulse.extract.PatternExtractor;
import io.serverpulse.logsource.LogQuery;
import io.serverpulse.logsource.LogQueryException;
import io.serverpulse.logsource.LogSource;
import io.serverpulse.model.MetricReading;
import io.serverpulse.model.PerformanceSample;
import io.serverpulse.probe.PidResolver;
import io.serverpulse.probe.ResourceProbe;
import io.serverpulse.probe.ResourceUsage;
import io.serverpulse.storage.PerformanceStore;
import io.serverpulse.storage.PlayerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Builds one performance sample per tick from the newest log lines and the server process.
 *
 * <p>The log tail is re-read every tick and may overlap the previous one; only the most recent
 * tps and view radius matter. Either source may be unavailable, in which case its fields stay
 * null and the sample is written anyway.
 */
public final class MetricSampler {
    private static final Logger log = LoggerFactory.getLogger(MetricSampler.class);

    private final LogSource logSource;
    private final PatternExtractor extractor;
    private final PidResolver pidResolver;
    private final ResourceProbe probe;
    private final PlayerStore players;
    private final PerformanceStore performance;
    private final Clock clock;
    private final int tailLines;
    private final Duration queryTimeout;

    public MetricSampler(
            LogSource logSource,
            PatternExtractor extractor,
            PidResolver pidResolver,
            ResourceProbe probe,
            PlayerStore players,
            PerformanceStore performance,
            Clock clock,
            int tailLines,
            Duration queryTimeout
    ) {
        this.logSource = logSource;
        this.extractor = extractor;
        this.pidResolver = pidResolver;
        this.probe = probe;
        this.players = players;
        this.performance = performance;
        this.clock = clock;
        this.tailLines = tailLines;
        this.queryTimeout = queryTimeout;
    }

    public SampleOutcome sample() {
        MetricReading reading = readLogMetrics();

        OptionalLong pid = resolvePid();
        Optional<ResourceUsage> usage = Optional.empty();
        if (pid.isPresent()) {
            usage = probeUsage(pid.getAsLong());
        }

        PerformanceSample sample = new PerformanceSample(
                clock.instant(),
                reading.tps(),
                usage.map(ResourceUsage::cpuPercent).orElse(null),
                usage.map(ResourceUsage::ramMb).orElse(null),
                usage.map(ResourceUsage::ramPercent).orElse(null),
                reading.viewRadius(),
                players.countOnline()
        );
        long id = performance.insert(sample);
        log.debug("Performance sample {}: tps={} cpu={} ramMb={} players={}",
                id, sample.tps(), sample.cpuPercent(), sample.ramMb(), sample.playersOnline());
        return new SampleOutcome(id, sample, pid.isPresent() ? pid.getAsLong() : null, usage.isPresent());
    }

    private MetricReading readLogMetrics() {
        try {
            List<String> lines = logSource.query(LogQuery.tail(tailLines, queryTimeout));
            return extractor.scanMetrics(lines);
        } catch (LogQueryException e) {
            log.warn("Log metrics unavailable this tick, query {}: {}", e.reason(), e.getMessage());
            return MetricReading.empty();
        }
    }

    private OptionalLong resolvePid() {
        try {
            return pidResolver.resolve();
        } catch (RuntimeException e) {
            log.warn("Server process lookup failed: {}", e.getMessage());
            return OptionalLong.empty();
        }
    }

    private Optional<ResourceUsage> probeUsage(long pid) {
        try {
            return probe.sample(pid);
        } catch (RuntimeException e) {
            log.warn("Resource probe failed for pid {}: {}", pid, e.getMessage());
            return Optional.empty();
        }
    }

    public record SampleOutcome(long sampleId, PerformanceSample sample, Long pid, boolean resourcesAvailable) {
    }
}
