package com.cellblock.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Cellblock.
 * Routes to subcommands: run, health.
 */
@Command(
        name = "cellblock",
        mixinStandardHelpOptions = true,
        version = "Cellblock 0.1.0",
        description = "Runs code cells inside isolated runtime JVMs",
        subcommands = {
                RunCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CellblockCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
