package io.serverpulse.reconcile;

import io.serverpulse.extract.LogTimestamps;
import io.serverpulse.extract.PatternExtractor;
import io.serverpulse.logsource.LogQuery;
import io.serverpulse.logsource.LogQueryException;
import io.serverpulse.logsource.LogSource;
import io.serverpulse.model.Checkpoint;
import io.serverpulse.model.EventKind;
import io.serverpulse.model.PlayerEvent;
import io.serverpulse.storage.CheckpointStore;
import io.serverpulse.storage.PlayerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns new log lines into player state.
 *
 * <p>Each {@link #ingest()} reads the window from the stored checkpoint up to now, merges the
 * extracted events one transaction per event, then moves the checkpoint to the last event in
 * source-line order. Events are never re-sorted by timestamp. A crash between merge and
 * checkpoint write only causes the same events to be merged again, which leaves player state
 * unchanged.
 */
public final class StateReconciler {
    private static final Logger log = LoggerFactory.getLogger(StateReconciler.class);

    private final LogSource logSource;
    private final PatternExtractor extractor;
    private final PlayerStore players;
    private final CheckpointStore checkpoints;
    private final Clock clock;
    private final Duration ingestLookback;
    private final Duration ingestTimeout;
    private final Duration backfillWindow;
    private final Duration backfillTimeout;

    public StateReconciler(
            LogSource logSource,
            PatternExtractor extractor,
            PlayerStore players,
            CheckpointStore checkpoints,
            Clock clock,
            Duration ingestLookback,
            Duration ingestTimeout,
            Duration backfillWindow,
            Duration backfillTimeout
    ) {
        this.logSource = logSource;
        this.extractor = extractor;
        this.players = players;
        this.checkpoints = checkpoints;
        this.clock = clock;
        this.ingestLookback = ingestLookback;
        this.ingestTimeout = ingestTimeout;
        this.backfillWindow = backfillWindow;
        this.backfillTimeout = backfillTimeout;
    }

    public IngestOutcome ingest() {
        Instant now = clock.instant();
        Optional<Checkpoint> before = checkpoints.read();
        Instant windowStart = windowStart(before, now);

        List<String> lines;
        try {
            lines = logSource.query(LogQuery.since(windowStart, ingestTimeout));
        } catch (LogQueryException e) {
            log.warn("Skipping ingestion tick, log query {}: {}", e.reason(), e.getMessage());
            return IngestOutcome.skipped(windowStart, e.reason().name());
        }

        List<PlayerEvent> events = extractor.extractEvents(lines);
        if (events.isEmpty()) {
            log.debug("No player events in {} lines since {}", lines.size(), windowStart);
            return IngestOutcome.idle(windowStart, lines.size(), before.map(Checkpoint::timestamp).orElse(null));
        }

        BatchOutcome batch = mergeBatch(events);
        if (batch.eventsRecorded() > 0) {
            log.info("Processed {} player events ({} new)", events.size(), batch.eventsRecorded());
        } else {
            log.debug("Re-read {} already merged player events", events.size());
        }
        return new IngestOutcome(
                false,
                null,
                windowStart,
                lines.size(),
                events.size(),
                batch.eventsRecorded(),
                batch.playersChanged(),
                batch.checkpointBefore(),
                batch.checkpointAfter(),
                batch.checkpointAdvanced()
        );
    }

    /**
     * Merges {@code events} in the given order and advances the checkpoint to the timestamp of
     * the last one. The checkpoint never moves to an earlier instant than the stored one.
     */
    public BatchOutcome mergeBatch(List<PlayerEvent> events) {
        String before = checkpoints.read().map(Checkpoint::timestamp).orElse(null);
        if (events == null || events.isEmpty()) {
            return new BatchOutcome(0, 0, 0, before, before, false);
        }
        int recorded = 0;
        int changed = 0;
        for (PlayerEvent event : events) {
            PlayerStore.MergeResult result = players.merge(event);
            if (result.recorded()) recorded++;
            if (result.playerChanged()) changed++;
        }

        PlayerEvent last = events.get(events.size() - 1);
        boolean advance = true;
        if (before != null) {
            Optional<Instant> stored = LogTimestamps.parse(before);
            if (stored.isPresent() && last.occurredAt().isBefore(stored.get())) {
                log.debug("Keeping checkpoint {}, last event {} is older", before, last.timestamp());
                advance = false;
            }
        }
        String after = before;
        if (advance) {
            checkpoints.write(last.timestamp(), clock.instant());
            after = last.timestamp();
        }
        boolean moved = after != null && !after.equals(before);
        return new BatchOutcome(events.size(), recorded, changed, before, after, moved);
    }

    /**
     * One-time wide scan run before the first ingestion tick. Events are folded in order into one
     * state per player (a leave-only player still gets a row here), then written with non-null
     * values winning over stored ones. The checkpoint is not touched.
     */
    public BackfillOutcome backfill() {
        Instant since = clock.instant().minus(backfillWindow);
        List<String> lines;
        try {
            lines = logSource.query(LogQuery.since(since, backfillTimeout));
        } catch (LogQueryException e) {
            log.warn("Initial player sync skipped, log query {}: {}", e.reason(), e.getMessage());
            return new BackfillOutcome(true, since, 0, 0, 0, 0);
        }
        List<PlayerEvent> events = extractor.extractEvents(lines);
        List<PlayerStore.PlayerSnapshot> snapshots = fold(events);
        PlayerStore.BackfillResult result = players.applyBackfill(snapshots, events);
        log.info("Initial player sync: {} players from {} events ({} lines since {})",
                result.playersWritten(), events.size(), lines.size(), since);
        return new BackfillOutcome(false, since, lines.size(), events.size(), result.playersWritten(), result.eventsRecorded());
    }

    static List<PlayerStore.PlayerSnapshot> fold(List<PlayerEvent> events) {
        Map<String, FoldedPlayer> byId = new LinkedHashMap<>();
        for (PlayerEvent event : events) {
            FoldedPlayer p = byId.computeIfAbsent(event.playerId(), id -> new FoldedPlayer(id, event.displayName()));
            if (event.kind() == EventKind.JOIN) {
                p.online = true;
                p.lastLogin = event.timestamp();
                p.lastLoginMs = event.occurredAt().toEpochMilli();
                if (event.world() != null) {
                    p.world = event.world();
                }
                p.displayName = event.displayName();
            } else {
                p.online = false;
                p.lastLogout = event.timestamp();
            }
        }
        List<PlayerStore.PlayerSnapshot> out = new ArrayList<>(byId.size());
        for (FoldedPlayer p : byId.values()) {
            out.add(new PlayerStore.PlayerSnapshot(
                    p.playerId, p.displayName, p.online, p.lastLogin, p.lastLoginMs, p.lastLogout, p.world
            ));
        }
        return out;
    }

    private Instant windowStart(Optional<Checkpoint> checkpoint, Instant now) {
        if (checkpoint.isPresent()) {
            Optional<Instant> parsed = LogTimestamps.parse(checkpoint.get().timestamp());
            if (parsed.isPresent()) {
                return parsed.get();
            }
            log.warn("Unreadable checkpoint '{}', scanning the last {}", checkpoint.get().timestamp(), ingestLookback);
        }
        return now.minus(ingestLookback);
    }

    private static final class FoldedPlayer {
        private final String playerId;
        private String displayName;
        private boolean online;
        private String lastLogin;
        private Long lastLoginMs;
        private String lastLogout;
        private String world;

        private FoldedPlayer(String playerId, String displayName) {
            this.playerId = playerId;
            this.displayName = displayName;
        }
    }

    public record BatchOutcome(
            int eventsMerged,
            int eventsRecorded,
            int playersChanged,
            String checkpointBefore,
            String checkpointAfter,
            boolean checkpointAdvanced
    ) {
    }

    public record IngestOutcome(
            boolean skipped,
            String skipReason,
            Instant windowStart,
            int linesRead,
            int eventsExtracted,
            int eventsRecorded,
            int playersChanged,
            String checkpointBefore,
            String checkpointAfter,
            boolean checkpointAdvanced
    ) {
        static IngestOutcome skipped(Instant windowStart, String reason) {
            return new IngestOutcome(true, reason, windowStart, 0, 0, 0, 0, null, null, false);
        }

        static IngestOutcome idle(Instant windowStart, int linesRead, String checkpoint) {
            return new IngestOutcome(false, null, windowStart, linesRead, 0, 0, 0, checkpoint, checkpoint, false);
        }
    }

    public record BackfillOutcome(
            boolean skipped,
            Instant windowStart,
            int linesRead,
            int eventsExtracted,
            int playersWritten,
            int eventsRecorded
    ) {
    }
}
