package io.serverpulse.exec;

public record CommandResult(
        Status status,
        int exitCode,
        String output,
        String error
) {
    public enum Status {
        COMPLETED,
        TIMEOUT,
        SPAWN_FAILED
    }

    public static CommandResult completed(int exitCode, String output, String error) {
        return new CommandResult(Status.COMPLETED, exitCode, output == null ? "" : output, error == null ? "" : error);
    }

    public static CommandResult timeout(String error) {
        return new CommandResult(Status.TIMEOUT, -1, "", error);
    }

    public static CommandResult spawnFailed(String error) {
        return new CommandResult(Status.SPAWN_FAILED, -1, "", error);
    }

    public boolean success() {
        return status == Status.COMPLETED && exitCode == 0;
    }
}
