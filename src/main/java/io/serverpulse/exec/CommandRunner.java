package io.serverpulse.exec;

import java.time.Duration;
import java.util.List;

/**
 * Runs an external command to completion under a hard timeout.
 */
public interface CommandRunner {
    CommandResult run(List<String> command, Duration timeout);
}
