package io.serverpulse.extract;

import io.serverpulse.model.EventKind;
import io.serverpulse.model.PlayerEvent;

import java.util.Optional;

/**
 * Recognizes one kind of player event in a single log line.
 */
public interface EventPattern {
    EventKind kind();

    Optional<PlayerEvent> match(String line);
}
