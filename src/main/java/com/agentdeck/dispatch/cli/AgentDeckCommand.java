package com.agentdeck.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for AgentDeck.
 * Routes to subcommands: run, check, allow, replay.
 */
@Command(
        name = "agentdeck",
        mixinStandardHelpOptions = true,
        version = "AgentDeck 0.1.0",
        description = "Supervises coding agents and decides which of their tool calls may run",
        subcommands = {
                RunCommand.class,
                CheckCommand.class,
                AllowCommand.class,
                ReplayCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AgentDeckCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
