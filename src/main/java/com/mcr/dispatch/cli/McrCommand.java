package com.mcr.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for MCR.
 * Routes to subcommands: run, route, strategies, health, serve.
 */
@Command(
        name = "mcr",
        mixinStandardHelpOptions = true,
        version = "MCR 0.1.0",
        description = "Neurosymbolic translation and reasoning over natural language",
        subcommands = {
                RunCommand.class,
                RouteCommand.class,
                StrategiesCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class McrCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
