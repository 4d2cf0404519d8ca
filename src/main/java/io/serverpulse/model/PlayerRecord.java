package io.serverpulse.model;

public record PlayerRecord(
        String playerId,
        String displayName,
        boolean online,
        String lastLogin,
        String lastLogout,
        String currentWorld,
        long cumulativePlaytimeSeconds
) {
}
