package io.serverpulse;

import io.serverpulse.cli.ServerPulseCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ServerPulseCommand()).execute(args);
        System.exit(code);
    }
}
