package io.serverpulse.runtime;

public enum SchedulerState {
    STARTING,
    RUNNING,
    SHUTTING_DOWN,
    STOPPED
}
