package io.serverpulse.probe;

import io.serverpulse.exec.CommandResult;
import io.serverpulse.testing.RecordingCommandRunner;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;

final class SystemdPidResolverTest {

    private static SystemdPidResolver resolver(RecordingCommandRunner runner) {
        return new SystemdPidResolver("hytale", "java", "HytaleServer.jar", runner, Duration.ofSeconds(1));
    }

    @Test
    void prefersJavaChildOfUnitMainPid() {
        RecordingCommandRunner runner = new RecordingCommandRunner()
                .on("systemctl show", CommandResult.completed(0, "812\n", ""))
                .on("pgrep -P", CommandResult.completed(0, "845\n", ""))
                .on("pgrep -f", CommandResult.completed(0, "999\n", ""));

        Assertions.assertEquals(OptionalLong.of(845L), resolver(runner).resolve());
        Assertions.assertEquals(List.of("pgrep", "-P", "812", "java"), runner.commands().get(1));
        Assertions.assertEquals(2, runner.commands().size());
    }

    @Test
    void fallsBackToCommandLineMatch() {
        RecordingCommandRunner runner = new RecordingCommandRunner()
                .on("systemctl show", CommandResult.completed(0, "812\n", ""))
                .on("pgrep -P", CommandResult.completed(1, "", ""))
                .on("pgrep -f", CommandResult.completed(0, "901\n902\n", ""));

        Assertions.assertEquals(OptionalLong.of(901L), resolver(runner).resolve());
        Assertions.assertEquals(List.of("pgrep", "-f", "HytaleServer.jar"), runner.commands().get(2));
    }

    @Test
    void stoppedUnitHasNoPid() {
        RecordingCommandRunner runner = new RecordingCommandRunner()
                .on("systemctl show", CommandResult.completed(0, "0\n", ""));

        Assertions.assertTrue(resolver(runner).resolve().isEmpty());
        Assertions.assertEquals(1, runner.commands().size());
    }

    @Test
    void missingSystemctlHasNoPid() {
        RecordingCommandRunner runner = new RecordingCommandRunner()
                .on("systemctl show", CommandResult.spawnFailed("no systemctl"));

        Assertions.assertTrue(resolver(runner).resolve().isEmpty());
    }

    @Test
    void firstPidIgnoresNoise() {
        Assertions.assertEquals(OptionalLong.of(12L), SystemdPidResolver.firstPid(" 12 13\n"));
        Assertions.assertTrue(SystemdPidResolver.firstPid("").isEmpty());
        Assertions.assertTrue(SystemdPidResolver.firstPid("abc").isEmpty());
    }
}
