package io.serverpulse.model;

import java.time.Instant;

/**
 * One metric tick. Nullable fields are unknown for that tick, which is not the same as zero.
 */
public record PerformanceSample(
        Instant timestamp,
        Integer tps,
        Double cpuPercent,
        Double ramMb,
        Double ramPercent,
        Integer viewRadius,
        int playersOnline
) {
}
