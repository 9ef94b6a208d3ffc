package io.dicehall;

import io.dicehall.cli.DiceHallCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new DiceHallCommand()).execute(args);
        System.exit(code);
    }
}
