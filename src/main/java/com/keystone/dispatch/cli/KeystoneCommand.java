package com.keystone.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Keystone.
 * Routes to subcommands: run, status, tools, health, serve.
 */
@Command(
        name = "keystone",
        mixinStandardHelpOptions = true,
        version = "Keystone 0.1.0",
        description = "Recursive multi-agent task orchestrator",
        subcommands = {
                RunCommand.class,
                StatusCommand.class,
                ToolsCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class KeystoneCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
