package dev.multiverse;

import dev.multiverse.cli.MultiverseCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new MultiverseCli()).execute(args);
        System.exit(exitCode);
    }
}
