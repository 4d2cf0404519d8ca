package io.serverpulse.model;

import java.time.Instant;

/**
 * @param timestamp source text of the last merged event timestamp
 * @param updatedAt when the cursor was last written, null for cursors written by older versions
 */
public record Checkpoint(String timestamp, Instant updatedAt) {
}
