package com.agentdock.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level {@code agentdock} command. Without a subcommand it prints usage.
 */
@Command(
        name = "agentdock",
        mixinStandardHelpOptions = true,
        version = "agentdock 0.1.0",
        description = "Run coding-agent tasks against isolated working copies",
        subcommands = {
                ServeCommand.class,
                SubmitCommand.class,
                ListCommand.class,
                StatusCommand.class,
                DiffCommand.class,
                CancelCommand.class,
                ResumeCommand.class,
                PromoteCommand.class,
                InputCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AgentdockCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
