package io.runscope;

import io.runscope.cli.RunScopeCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new RunScopeCommand()).execute(args);
        System.exit(code);
    }
}
