package io.serverpulse.probe;

import io.serverpulse.exec.CommandResult;
import io.serverpulse.exec.CommandRunner;

import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;

/**
 * Resolves the server JVM in three steps: the unit's main PID from systemd, then a
 * {@code java} child of that PID, then any process whose command line contains the server
 * jar name. The unit's main PID is usually a wrapper script, so it is never returned itself.
 */
public final class SystemdPidResolver implements PidResolver {
    private final String unit;
    private final String javaProcessName;
    private final String processMatch;
    private final CommandRunner runner;
    private final Duration timeout;

    public SystemdPidResolver(String unit, String javaProcessName, String processMatch, CommandRunner runner, Duration timeout) {
        this.unit = unit;
        this.javaProcessName = javaProcessName;
        this.processMatch = processMatch;
        this.runner = runner;
        this.timeout = timeout;
    }

    @Override
    public OptionalLong resolve() {
        CommandResult main = runner.run(List.of("systemctl", "show", unit, "--property=MainPID", "--value"), timeout);
        if (!main.success()) {
            return OptionalLong.empty();
        }
        OptionalLong wrapperPid = firstPid(main.output());
        if (wrapperPid.isEmpty() || wrapperPid.getAsLong() == 0L) {
            return OptionalLong.empty();
        }

        CommandResult child = runner.run(
                List.of("pgrep", "-P", Long.toString(wrapperPid.getAsLong()), javaProcessName),
                timeout
        );
        if (child.success()) {
            OptionalLong pid = firstPid(child.output());
            if (pid.isPresent()) {
                return pid;
            }
        }

        CommandResult fallback = runner.run(List.of("pgrep", "-f", processMatch), timeout);
        if (fallback.success()) {
            return firstPid(fallback.output());
        }
        return OptionalLong.empty();
    }

    static OptionalLong firstPid(String output) {
        if (output == null || output.isBlank()) {
            return OptionalLong.empty();
        }
        String first = output.trim().split("\\s+")[0];
        try {
            return OptionalLong.of(Long.parseLong(first));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
