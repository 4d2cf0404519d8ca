package io.serverpulse.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single join or leave occurrence extracted from one log line.
 *
 * <p>{@code timestamp} keeps the text exactly as the log printed it; {@code occurredAt} is the
 * same moment resolved to an instant. {@code world} is only set for joins.
 */
public record PlayerEvent(
        String timestamp,
        Instant occurredAt,
        String playerId,
        String displayName,
        EventKind kind,
        String world
) {
    public PlayerEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(occurredAt, "occurredAt");
        Objects.requireNonNull(playerId, "playerId");
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(kind, "kind");
        if (kind == EventKind.LEAVE) {
            world = null;
        }
    }

    public static PlayerEvent join(String timestamp, Instant occurredAt, String playerId, String displayName, String world) {
        return new PlayerEvent(timestamp, occurredAt, playerId, displayName, EventKind.JOIN, world);
    }

    public static PlayerEvent leave(String timestamp, Instant occurredAt, String playerId, String displayName) {
        return new PlayerEvent(timestamp, occurredAt, playerId, displayName, EventKind.LEAVE, null);
    }
}
