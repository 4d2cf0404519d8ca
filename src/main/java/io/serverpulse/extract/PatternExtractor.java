package io.serverpulse.extract;

import io.serverpulse.model.MetricReading;
import io.serverpulse.model.PlayerEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless translation of raw log lines into player events and metric readings.
 */
public final class PatternExtractor {
    private static final Pattern TPS = Pattern.compile("Setting TPS of world \\w+ to (\\d+)");
    private static final Pattern VIEW_RADIUS = Pattern.compile("(?:Initial view radius is|View radius.*?to) (\\d+)");

    private final List<EventPattern> patterns;

    public PatternExtractor() {
        this(List.of(new JoinEventPattern(), new LeaveEventPattern()));
    }

    public PatternExtractor(List<EventPattern> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("at least one event pattern is required");
        }
        this.patterns = List.copyOf(patterns);
    }

    /**
     * Events in source-line order. A line yields at most one event: the first pattern that
     * matches wins. Non-matching lines are skipped.
     */
    public List<PlayerEvent> extractEvents(List<String> lines) {
        List<PlayerEvent> out = new ArrayList<>();
        if (lines == null) {
            return out;
        }
        for (String line : lines) {
            for (EventPattern pattern : patterns) {
                Optional<PlayerEvent> event = pattern.match(line);
                if (event.isPresent()) {
                    out.add(event.get());
                    break;
                }
            }
        }
        return out;
    }

    /**
     * Scans newest to oldest (the end of the list first) and keeps the first tps and the first
     * view radius found. The two values may come from different lines.
     */
    public MetricReading scanMetrics(List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return MetricReading.empty();
        }
        Integer tps = null;
        Integer viewRadius = null;
        for (int i = lines.size() - 1; i >= 0; i--) {
            String line = lines.get(i);
            if (line == null) {
                continue;
            }
            if (tps == null) {
                tps = firstInt(TPS, line);
            }
            if (viewRadius == null) {
                viewRadius = firstInt(VIEW_RADIUS, line);
            }
            if (tps != null && viewRadius != null) {
                break;
            }
        }
        return new MetricReading(tps, viewRadius);
    }

    private static Integer firstInt(Pattern pattern, String line) {
        Matcher m = pattern.matcher(line);
        if (!m.find()) {
            return null;
        }
        try {
            return Integer.valueOf(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
