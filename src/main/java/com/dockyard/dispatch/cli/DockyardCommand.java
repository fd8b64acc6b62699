package com.dockyard.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Dockyard.
 * Routes to subcommands: serve, health, jobs, queue, token.
 */
@Command(
        name = "dockyard",
        mixinStandardHelpOptions = true,
        version = "Dockyard 0.1.0",
        description = "Sandbox orchestrator: job queue, presence reaper and production deployments",
        subcommands = {
                ServeCommand.class,
                HealthCommand.class,
                JobsCommand.class,
                QueueCommand.class,
                TokenCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class DockyardCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
