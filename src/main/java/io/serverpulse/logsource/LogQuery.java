package io.serverpulse.logsource;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Either a time window starting at {@code since} and ending now, or the newest
 * {@code tailLines} lines. Exactly one of the two is set.
 */
public record LogQuery(Instant since, Integer tailLines, Duration timeout) {
    public LogQuery {
        Objects.requireNonNull(timeout, "timeout");
        if ((since == null) == (tailLines == null)) {
            throw new IllegalArgumentException("exactly one of since or tailLines must be set");
        }
        if (tailLines != null && tailLines < 1) {
            throw new IllegalArgumentException("tailLines must be >= 1");
        }
    }

    public static LogQuery since(Instant since, Duration timeout) {
        return new LogQuery(since, null, timeout);
    }

    public static LogQuery tail(int lines, Duration timeout) {
        return new LogQuery(null, lines, timeout);
    }

    public boolean isWindow() {
        return since != null;
    }
}
