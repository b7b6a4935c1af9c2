package com.agentdock.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: agentdock resume &lt;task-id&gt;
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Restart the unfinished repositories of a task")
@Component
public class ResumeCommand implements Callable<Integer> {

    @Mixin
    ServerOptions server;

    @Parameters(index = "0", description = "Task ID")
    String taskId;

    private final AgentdockClient client;

    public ResumeCommand(AgentdockClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        try {
            client.resume(server.baseUrl(), taskId);
            ConsoleOutput.success("Task " + taskId + " resumed");
            return 0;
        } catch (ClientException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
