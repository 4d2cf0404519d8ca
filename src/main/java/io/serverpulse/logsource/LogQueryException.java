package io.serverpulse.logsource;

/**
 * The log source could not answer a query. Callers skip the current tick.
 */
public final class LogQueryException extends Exception {
    public enum Reason {
        TIMEOUT,
        FAILURE
    }

    private final Reason reason;

    public LogQueryException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
