package io.causelog;

import io.causelog.cli.CauseLogCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new CauseLogCommand()).execute(args);
        System.exit(code);
    }
}
