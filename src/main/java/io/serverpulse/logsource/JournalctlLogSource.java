package io.serverpulse.logsource;

import io.serverpulse.exec.CommandResult;
import io.serverpulse.exec.CommandRunner;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads the journal of a systemd unit through {@code journalctl}.
 */
public final class JournalctlLogSource implements LogSource {
    private static final DateTimeFormatter SINCE_FORMAT = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT)
            .withZone(ZoneOffset.UTC);

    private final String unit;
    private final CommandRunner runner;

    public JournalctlLogSource(String unit, CommandRunner runner) {
        if (unit == null || unit.isBlank()) {
            throw new IllegalArgumentException("unit cannot be empty");
        }
        this.unit = unit.trim();
        this.runner = runner;
    }

    @Override
    public List<String> query(LogQuery query) throws LogQueryException {
        CommandResult result = runner.run(command(query), query.timeout());
        switch (result.status()) {
            case TIMEOUT -> throw new LogQueryException(LogQueryException.Reason.TIMEOUT, result.error());
            case SPAWN_FAILED -> throw new LogQueryException(LogQueryException.Reason.FAILURE, result.error());
            default -> {
            }
        }
        if (result.exitCode() != 0) {
            throw new LogQueryException(
                    LogQueryException.Reason.FAILURE,
                    "journalctl exit=" + result.exitCode() + " error=" + result.error()
            );
        }
        return result.output().lines()
                .filter(line -> !line.isBlank())
                .toList();
    }

    List<String> command(LogQuery query) {
        List<String> cmd = new ArrayList<>();
        cmd.add("journalctl");
        cmd.add("-u");
        cmd.add(unit);
        cmd.add("--no-pager");
        cmd.add("-q");
        cmd.add("--utc");
        cmd.add("-o");
        cmd.add("short-iso");
        if (query.isWindow()) {
            cmd.add("--since");
            cmd.add(SINCE_FORMAT.format(query.since()) + " UTC");
        } else {
            cmd.add("-n");
            cmd.add(Integer.toString(query.tailLines()));
        }
        return cmd;
    }
}
