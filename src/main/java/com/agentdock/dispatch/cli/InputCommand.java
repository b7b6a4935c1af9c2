package com.agentdock.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: agentdock input &lt;task-id&gt; "&lt;text&gt;"
 * <p>
 * Writes a line to the stdin of the task's live processes.
 */
@Command(name = "input", mixinStandardHelpOptions = true, description = "Send a line to running agents")
@Component
public class InputCommand implements Callable<Integer> {

    @Mixin
    ServerOptions server;

    @Parameters(index = "0", description = "Task ID")
    String taskId;

    @Parameters(index = "1", description = "Text to send; a trailing newline is added")
    String text;

    @Option(names = {"--repo", "-r"}, description = "Send only to this repository's process")
    String repoId;

    private final AgentdockClient client;

    public InputCommand(AgentdockClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        try {
            client.sendInput(server.baseUrl(), taskId, repoId, text);
            ConsoleOutput.success("Sent to " + (repoId != null ? repoId : "all live repositories"));
            return 0;
        } catch (ClientException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
