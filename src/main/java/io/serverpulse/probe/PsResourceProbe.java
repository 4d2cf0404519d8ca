package io.serverpulse.probe;

import io.serverpulse.exec.CommandResult;
import io.serverpulse.exec.CommandRunner;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Reads {@code %cpu}, {@code %mem} and {@code rss} (KiB) of one process from {@code ps}.
 */
public final class PsResourceProbe implements ResourceProbe {
    private final CommandRunner runner;
    private final Duration timeout;

    public PsResourceProbe(CommandRunner runner, Duration timeout) {
        this.runner = runner;
        this.timeout = timeout;
    }

    @Override
    public Optional<ResourceUsage> sample(long pid) {
        CommandResult result = runner.run(
                List.of("ps", "-p", Long.toString(pid), "-o", "%cpu,%mem,rss", "--no-headers"),
                timeout
        );
        if (!result.success()) {
            return Optional.empty();
        }
        return parse(result.output());
    }

    static Optional<ResourceUsage> parse(String output) {
        if (output == null || output.isBlank()) {
            return Optional.empty();
        }
        String[] parts = output.trim().split("\\s+");
        if (parts.length < 3) {
            return Optional.empty();
        }
        try {
            return Optional.of(new ResourceUsage(
                    Double.parseDouble(parts[0]),
                    Double.parseDouble(parts[1]),
                    Long.parseLong(parts[2])
            ));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
