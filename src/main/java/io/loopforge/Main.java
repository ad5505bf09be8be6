package io.loopforge;

import io.loopforge.cli.LoopForgeCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new LoopForgeCommand()).execute(args);
        System.exit(code);
    }
}
