package io.serverpulse.runtime;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stop request shared between the scheduler loop and whoever asks it to stop (a JVM shutdown
 * hook, a test). The loop polls it once per iteration.
 */
public final class StopSignal {
    private final AtomicBoolean requested = new AtomicBoolean(false);

    public void request() {
        requested.set(true);
    }

    public boolean isRequested() {
        return requested.get();
    }
}
