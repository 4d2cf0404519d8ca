package io.serverpulse.storage;

/**
 * A read or write against the SQLite store failed. The current tick is abandoned; the next
 * one starts again from the stored checkpoint.
 */
public final class StorageException extends RuntimeException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
