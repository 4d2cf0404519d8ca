package io.serverpulse.model;

public record EventLogEntry(
        long id,
        String timestamp,
        long occurredAtMs,
        String playerId,
        String displayName,
        EventKind kind,
        String world
) {
}
