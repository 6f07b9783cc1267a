package com.socmind.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for SocMind.
 * Routes to subcommands: task, scenario, serve, health.
 */
@Command(
        name = "socmind",
        mixinStandardHelpOptions = true,
        version = "SocMind 0.1.0",
        description = "Security-operations orchestration engine",
        subcommands = {
                TaskCommand.class,
                ScenarioCommand.class,
                ServeCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SocmindCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
