package io.serverpulse.logsource;

import io.serverpulse.exec.CommandResult;
import io.serverpulse.testing.RecordingCommandRunner;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

final class JournalctlLogSourceTest {

    @Test
    void windowQueryUsesUtcSince() {
        JournalctlLogSource source = new JournalctlLogSource("hytale", new RecordingCommandRunner());

        List<String> cmd = source.command(LogQuery.since(Instant.parse("2024-01-01T10:00:05.900Z"), Duration.ofSeconds(30)));

        Assertions.assertEquals(
                List.of("journalctl", "-u", "hytale", "--no-pager", "-q", "--utc", "-o", "short-iso",
                        "--since", "2024-01-01 10:00:05 UTC"),
                cmd
        );
    }

    @Test
    void tailQueryUsesLineCount() {
        JournalctlLogSource source = new JournalctlLogSource("hytale", new RecordingCommandRunner());

        List<String> cmd = source.command(LogQuery.tail(200, Duration.ofSeconds(10)));

        Assertions.assertEquals("-n", cmd.get(cmd.size() - 2));
        Assertions.assertEquals("200", cmd.get(cmd.size() - 1));
    }

    @Test
    void returnsNonBlankLinesInOrder() throws Exception {
        RecordingCommandRunner runner = new RecordingCommandRunner()
                .on("journalctl", CommandResult.completed(0, "first\n\n  \nsecond\nthird\n", ""));
        JournalctlLogSource source = new JournalctlLogSource("hytale", runner);

        List<String> lines = source.query(LogQuery.tail(3, Duration.ofSeconds(1)));

        Assertions.assertEquals(List.of("first", "second", "third"), lines);
        Assertions.assertEquals(1, runner.commands().size());
    }

    @Test
    void timeoutAndFailuresAreReported() {
        JournalctlLogSource timingOut = new JournalctlLogSource(
                "hytale", new RecordingCommandRunner().on("journalctl", CommandResult.timeout("slow")));
        LogQueryException timeout = Assertions.assertThrows(
                LogQueryException.class, () -> timingOut.query(LogQuery.tail(1, Duration.ofMillis(5))));
        Assertions.assertEquals(LogQueryException.Reason.TIMEOUT, timeout.reason());

        JournalctlLogSource failing = new JournalctlLogSource(
                "hytale", new RecordingCommandRunner().on("journalctl", CommandResult.completed(1, "", "No journal files")));
        LogQueryException failure = Assertions.assertThrows(
                LogQueryException.class, () -> failing.query(LogQuery.tail(1, Duration.ofMillis(5))));
        Assertions.assertEquals(LogQueryException.Reason.FAILURE, failure.reason());

        JournalctlLogSource missing = new JournalctlLogSource(
                "hytale", new RecordingCommandRunner().on("journalctl", CommandResult.spawnFailed("not found")));
        LogQueryException spawn = Assertions.assertThrows(
                LogQueryException.class, () -> missing.query(LogQuery.tail(1, Duration.ofMillis(5))));
        Assertions.assertEquals(LogQueryException.Reason.FAILURE, spawn.reason());
    }

    @Test
    void queryNeedsExactlyOneShape() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new LogQuery(Instant.EPOCH, 10, Duration.ofSeconds(1)));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new LogQuery(null, null, Duration.ofSeconds(1)));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> LogQuery.tail(0, Duration.ofSeconds(1)));
    }
}
