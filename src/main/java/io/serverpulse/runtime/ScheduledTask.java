package io.serverpulse.runtime;

import java.time.Duration;
import java.util.Objects;

/**
 * A named periodic job with its own elapsed-time timer. Only the scheduler thread touches the
 * timer; run and failure counters are read by status callers.
 */
public final class ScheduledTask {
    private final String name;
    private final long intervalNanos;
    private final Runnable action;
    private boolean hasRun;
    private long lastRunNanos;
    private volatile long runs;
    private volatile long failures;

    public ScheduledTask(String name, Duration interval, Runnable action) {
        this.name = Objects.requireNonNull(name, "name");
        this.intervalNanos = Objects.requireNonNull(interval, "interval").toNanos();
        this.action = Objects.requireNonNull(action, "action");
        if (intervalNanos <= 0L) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
    }

    public String name() {
        return name;
    }

    public Duration interval() {
        return Duration.ofNanos(intervalNanos);
    }

    public long runs() {
        return runs;
    }

    public long failures() {
        return failures;
    }

    boolean isDue(long nowNanos) {
        return !hasRun || nowNanos - lastRunNanos >= intervalNanos;
    }

    void markRun(long nowNanos) {
        hasRun = true;
        lastRunNanos = nowNanos;
    }

    void execute() {
        runs++;
        action.run();
    }

    void recordFailure() {
        failures++;
    }
}
