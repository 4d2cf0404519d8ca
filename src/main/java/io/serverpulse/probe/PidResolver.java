package io.serverpulse.probe;

import java.util.OptionalLong;

/**
 * Locates the game server process. An empty result means "not running", not a failure.
 */
public interface PidResolver {
    OptionalLong resolve();
}
