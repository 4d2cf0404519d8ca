package io.serverpulse.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Single-threaded tick loop.
 *
 * <p>{@link #run()} performs startup, then wakes every tick and runs each task whose interval
 * has elapsed since its own last run. A task that has never run is due at once. Missed
 * intervals are not caught up. A task failure is logged and counted and never stops the loop;
 * only the stop signal does, checked between tasks and after every sleep.
 */
public final class Scheduler {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final Runnable startup;
    private final List<ScheduledTask> tasks;
    private final Runnable shutdown;
    private final StopSignal stopSignal;
    private final Duration tick;
    private final LongSupplier nanoTime;
    private final Sleeper sleeper;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile SchedulerState state = SchedulerState.STARTING;

    public Scheduler(
            Runnable startup,
            List<ScheduledTask> tasks,
            Runnable shutdown,
            StopSignal stopSignal,
            Duration tick,
            LongSupplier nanoTime,
            Sleeper sleeper
    ) {
        this.startup = Objects.requireNonNull(startup, "startup");
        this.tasks = List.copyOf(tasks);
        this.shutdown = Objects.requireNonNull(shutdown, "shutdown");
        this.stopSignal = Objects.requireNonNull(stopSignal, "stopSignal");
        this.tick = Objects.requireNonNull(tick, "tick");
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Blocks until the stop signal is observed. Storage is released through the shutdown action
     * on every exit path.
     *
     * @throws StartupException when the startup action fails; no task has run in that case
     */
    public void run() throws StartupException {
        state = SchedulerState.STARTING;
        log.info("Worker starting");
        try {
            startup.run();
        } catch (RuntimeException e) {
            log.error("Worker startup failed", e);
            finish();
            throw new StartupException("Worker startup failed: " + e.getMessage(), e);
        }

        state = SchedulerState.RUNNING;
        log.info("Worker running: tick={} tasks={}", tick, describeTasks());
        try {
            loop();
        } finally {
            state = SchedulerState.SHUTTING_DOWN;
            log.info("Worker shutting down");
            finish();
        }
    }

    public SchedulerState state() {
        return state;
    }

    public List<ScheduledTask> tasks() {
        return tasks;
    }

    public void requestStop() {
        stopSignal.request();
    }

    /**
     * Waits for the loop to reach {@link SchedulerState#STOPPED}.
     *
     * @return false when the timeout elapsed first
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void loop() {
        while (!stopSignal.isRequested()) {
            for (ScheduledTask task : tasks) {
                if (stopSignal.isRequested()) {
                    return;
                }
                long now = nanoTime.getAsLong();
                if (task.isDue(now)) {
                    task.markRun(now);
                    runTask(task);
                }
            }
            if (stopSignal.isRequested()) {
                return;
            }
            try {
                sleeper.sleep(tick);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Worker interrupted, stopping");
                stopSignal.request();
            }
        }
    }

    private void runTask(ScheduledTask task) {
        try {
            task.execute();
        } catch (Exception e) {
            task.recordFailure();
            log.error("Task {} failed (failure #{})", task.name(), task.failures(), e);
        }
    }

    private void finish() {
        try {
            shutdown.run();
        } catch (RuntimeException e) {
            log.error("Worker shutdown action failed", e);
        } finally {
            state = SchedulerState.STOPPED;
            stopped.countDown();
            log.info("Worker stopped");
        }
    }

    private String describeTasks() {
        StringBuilder sb = new StringBuilder();
        for (ScheduledTask task : tasks) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(task.name()).append('=').append(task.interval());
        }
        return sb.toString();
    }
}
