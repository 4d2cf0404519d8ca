package io.serverpulse.runtime;

/**
 * Storage, schema or settings could not be brought up. The worker does not start.
 */
public final class StartupException extends Exception {
    public StartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
