package io.serverpulse.extract;

import io.serverpulse.model.EventKind;
import io.serverpulse.model.MetricReading;
import io.serverpulse.model.PlayerEvent;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

final class PatternExtractorTest {
    private final PatternExtractor extractor = new PatternExtractor();

    @Test
    void joinLineProducesJoinEvent() {
        List<PlayerEvent> events = extractor.extractEvents(List.of(
                "2024-01-01T10:00:00 ... Adding player 'Alice' to world 'Overworld' at location ... (abc-123)"
        ));

        Assertions.assertEquals(1, events.size());
        PlayerEvent join = events.get(0);
        Assertions.assertEquals(EventKind.JOIN, join.kind());
        Assertions.assertEquals("abc-123", join.playerId());
        Assertions.assertEquals("Alice", join.displayName());
        Assertions.assertEquals("Overworld", join.world());
        Assertions.assertEquals("2024-01-01T10:00:00", join.timestamp());
        Assertions.assertEquals(Instant.parse("2024-01-01T10:00:00Z"), join.occurredAt());
    }

    @Test
    void journalPrefixedLinesKeepSourceTimestampText() {
        List<PlayerEvent> events = extractor.extractEvents(List.of(
                "2024-03-05T21:14:09+0000 host start-hytale.sh[812]: [2024/03/05 21:14:09 INFO] [World|default] "
                        + "Adding player 'Bob' to world 'default' at location (12.0, 64.0, -3.5) (0f1e2d3c-aaaa-bbbb-cccc-123456789abc)"
        ));

        Assertions.assertEquals(1, events.size());
        Assertions.assertEquals("2024-03-05T21:14:09+0000", events.get(0).timestamp());
        Assertions.assertEquals(Instant.parse("2024-03-05T21:14:09Z"), events.get(0).occurredAt());
        Assertions.assertEquals("0f1e2d3c-aaaa-bbbb-cccc-123456789abc", events.get(0).playerId());
        Assertions.assertEquals("default", events.get(0).world());
    }

    @Test
    void leaveLineStripsParenthesizedSuffixFromName() {
        List<PlayerEvent> events = extractor.extractEvents(List.of(
                "2024-01-01T11:30:00 [Universe] Removing player 'Alice (Alice)' from world (abc-123)"
        ));

        Assertions.assertEquals(1, events.size());
        PlayerEvent leave = events.get(0);
        Assertions.assertEquals(EventKind.LEAVE, leave.kind());
        Assertions.assertEquals("Alice", leave.displayName());
        Assertions.assertEquals("abc-123", leave.playerId());
        Assertions.assertNull(leave.world());
    }

    @Test
    void leaveLineWithoutSuffix() {
        List<PlayerEvent> events = extractor.extractEvents(List.of(
                "2024-01-01T11:30:00 Removing player 'Carol' (def-456)"
        ));

        Assertions.assertEquals(1, events.size());
        Assertions.assertEquals("Carol", events.get(0).displayName());
        Assertions.assertEquals("def-456", events.get(0).playerId());
    }

    @Test
    void eventsKeepSourceOrderAndSkipNoise() {
        List<PlayerEvent> events = extractor.extractEvents(List.of(
                "2024-01-01T10:00:05 Removing player 'Alice' (abc-123)",
                "2024-01-01T10:00:01 server tick took 12ms",
                "",
                "not a log line at all",
                "2024-01-01T10:00:00 Adding player 'Alice' to world 'Overworld' at location (0, 0, 0) (abc-123)"
        ));

        Assertions.assertEquals(2, events.size());
        Assertions.assertEquals(EventKind.LEAVE, events.get(0).kind());
        Assertions.assertEquals(EventKind.JOIN, events.get(1).kind());
    }

    @Test
    void unparseableTimestampDropsTheLine() {
        List<PlayerEvent> events = extractor.extractEvents(List.of(
                "2024-13-45Tgarbage Adding player 'Alice' to world 'Overworld' at location (0) (abc-123)"
        ));

        Assertions.assertTrue(events.isEmpty());
    }

    @Test
    void newestTpsWins() {
        MetricReading reading = extractor.scanMetrics(List.of(
                "2024-01-01T10:00:00 Setting TPS of world default to 18",
                "2024-01-01T10:00:05 Setting TPS of world default to 20"
        ));

        Assertions.assertEquals(20, reading.tps());
        Assertions.assertNull(reading.viewRadius());
        Assertions.assertFalse(reading.complete());
    }

    @Test
    void tpsAndViewRadiusMayComeFromDifferentLines() {
        MetricReading reading = extractor.scanMetrics(List.of(
                "2024-01-01T09:00:00 Initial view radius is 12",
                "2024-01-01T09:30:00 View radius of player Alice changed to 8",
                "2024-01-01T10:00:00 Setting TPS of world default to 30",
                "2024-01-01T10:00:01 unrelated"
        ));

        Assertions.assertEquals(30, reading.tps());
        Assertions.assertEquals(8, reading.viewRadius());
        Assertions.assertTrue(reading.complete());
    }

    @Test
    void noMetricLinesYieldEmptyReading() {
        Assertions.assertEquals(MetricReading.empty(), extractor.scanMetrics(List.of("a", "b")));
        Assertions.assertEquals(MetricReading.empty(), extractor.scanMetrics(List.of()));
    }

    @Test
    void firstMatchingPatternWins() {
        EventPattern alwaysLeave = new EventPattern() {
            @Override
            public EventKind kind() {
                return EventKind.LEAVE;
            }

            @Override
            public Optional<PlayerEvent> match(String line) {
                return Optional.of(PlayerEvent.leave("2024-01-01T00:00:00", Instant.EPOCH, "x", "X"));
            }
        };
        PatternExtractor custom = new PatternExtractor(List.of(alwaysLeave, new JoinEventPattern()));

        List<PlayerEvent> events = custom.extractEvents(List.of(
                "2024-01-01T10:00:00 Adding player 'Alice' to world 'Overworld' at location (0) (abc-123)"
        ));

        Assertions.assertEquals(1, events.size());
        Assertions.assertEquals(EventKind.LEAVE, events.get(0).kind());
    }
}
