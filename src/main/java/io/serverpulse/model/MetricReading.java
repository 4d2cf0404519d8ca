package io.serverpulse.model;

/**
 * Latest tps and view radius seen in a log slice; each field is null when no line carried it.
 */
public record MetricReading(Integer tps, Integer viewRadius) {
    public static MetricReading empty() {
        return new MetricReading(null, null);
    }

    public boolean complete() {
        return tps != null && viewRadius != null;
    }
}
