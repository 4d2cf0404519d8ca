package io.serverpulse.exec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * <p>Output goes to temporary files rather than pipes so that large outputs (a week of journal
 * lines) cannot block the child on a full pipe buffer before the timeout expires.
 */
public final class ProcessCommandRunner implements CommandRunner {
    private static final int MAX_ERROR_CHARS = 512;

    @Override
    public CommandResult run(List<String> command, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        long timeoutMs = Math.max(1L, timeout == null ? 10_000L : timeout.toMillis());
        Path stdout = null;
        Path stderr = null;
        try {
            stdout = Files.createTempFile("serverpulse-cmd-", ".out");
            stderr = Files.createTempFile("serverpulse-cmd-", ".err");
            ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
            pb.redirectOutput(stdout.toFile());
            pb.redirectError(stderr.toFile());
            Process process;
            try {
                process = pb.start();
            } catch (IOException e) {
                return CommandResult.spawnFailed(command.get(0) + " spawn failed: " + e.getMessage());
            }
            try {
                process.getOutputStream().close();
                boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
                if (!finished) {
                    process.destroyForcibly();
                    process.waitFor(1, TimeUnit.SECONDS);
                    return CommandResult.timeout(command.get(0) + " timeout after " + Duration.ofMillis(timeoutMs));
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                return CommandResult.timeout(command.get(0) + " interrupted");
            } catch (IOException e) {
                process.destroyForcibly();
                return CommandResult.spawnFailed(command.get(0) + " stdin close failed: " + e.getMessage());
            }
            String out = Files.readString(stdout, StandardCharsets.UTF_8);
            String err = truncate(Files.readString(stderr, StandardCharsets.UTF_8));
            return CommandResult.completed(process.exitValue(), out, err);
        } catch (IOException e) {
            return CommandResult.spawnFailed(command.get(0) + " output capture failed: " + e.getMessage());
        } finally {
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException ignored) {
            // temp file, the OS cleans it up eventually
        }
    }
}
