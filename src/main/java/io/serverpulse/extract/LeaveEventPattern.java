package io.serverpulse.extract;

import io.serverpulse.model.EventKind;
import io.serverpulse.model.PlayerEvent;

import java.time.Instant;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code <ts> ... Removing player 'Name (suffix)' ... (player-id)}, the id closing the line.
 * The parenthesized suffix inside the quotes is optional and not part of the name.
 */
public final class LeaveEventPattern implements EventPattern {
    private static final Pattern LEAVE = Pattern.compile(
            "(\\d{4}-\\d{2}-\\d{2}T\\S+).*Removing player '([^']+?)(?:\\s*\\([^)]+\\))?'.*\\(([a-fA-F0-9-]+)\\)\\s*$"
    );

    @Override
    public EventKind kind() {
        return EventKind.LEAVE;
    }

    @Override
    public Optional<PlayerEvent> match(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher m = LEAVE.matcher(line);
        if (!m.find()) {
            return Optional.empty();
        }
        String timestamp = m.group(1);
        Optional<Instant> at = LogTimestamps.parse(timestamp);
        if (at.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(PlayerEvent.leave(timestamp, at.get(), m.group(3), m.group(2)));
    }
}
