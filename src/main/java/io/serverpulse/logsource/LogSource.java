package io.serverpulse.logsource;

import java.util.List;

/**
 * Append-only text log of the game server, oldest line first.
 */
public interface LogSource {
    List<String> query(LogQuery query) throws LogQueryException;
}
