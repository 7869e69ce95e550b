package io.quirrel;

import io.quirrel.cli.QuirrelCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new QuirrelCommand()).execute(args);
        System.exit(code);
    }
}
