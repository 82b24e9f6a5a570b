package com.workhub.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command.
 * Routes to subcommands: process, health, serve.
 */
@Command(
        name = "workhub",
        mixinStandardHelpOptions = true,
        version = "WorkHub Agent 0.1.0",
        description = "Classifies field worker messages and routes them to the right action",
        subcommands = {
                ProcessCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class WorkhubCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
