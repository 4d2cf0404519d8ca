package io.serverpulse.model;

import java.util.Locale;

public enum EventKind {
    JOIN,
    LEAVE;

    public String storageValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EventKind fromStorage(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("event kind must not be null");
        }
        return EventKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
