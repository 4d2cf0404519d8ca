package io.serverpulse.extract;

import io.serverpulse.model.EventKind;
import io.serverpulse.model.PlayerEvent;

import java.time.Instant;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code <ts> ... Adding player 'Name' to world 'World' at location ... (player-id)}
 */
public final class JoinEventPattern implements EventPattern {
    private static final Pattern JOIN = Pattern.compile(
            "(\\d{4}-\\d{2}-\\d{2}T\\S+).*Adding player '([^']+)' to world '([^']+)' at location .+\\(([a-fA-F0-9-]+)\\)"
    );

    @Override
    public EventKind kind() {
        return EventKind.JOIN;
    }

    @Override
    public Optional<PlayerEvent> match(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher m = JOIN.matcher(line);
        if (!m.find()) {
            return Optional.empty();
        }
        String timestamp = m.group(1);
        Optional<Instant> at = LogTimestamps.parse(timestamp);
        if (at.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(PlayerEvent.join(timestamp, at.get(), m.group(4), m.group(2), m.group(3)));
    }
}
