package com.converge.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Converge.
 * Routes to subcommands: delete, resources.
 */
@Command(
        name = "converge",
        mixinStandardHelpOptions = true,
        version = "Converge 0.1.0",
        description = "Plans and applies changes to serverless cloud resources",
        subcommands = {
                DeleteCommand.class,
                ResourcesCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ConvergeCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
