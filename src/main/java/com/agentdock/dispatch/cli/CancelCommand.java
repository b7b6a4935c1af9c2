package com.agentdock.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: agentdock cancel &lt;task-id&gt;
 */
@Command(name = "cancel", mixinStandardHelpOptions = true, description = "Cancel a task and stop its processes")
@Component
public class CancelCommand implements Callable<Integer> {

    @Mixin
    ServerOptions server;

    @Parameters(index = "0", description = "Task ID")
    String taskId;

    private final AgentdockClient client;

    public CancelCommand(AgentdockClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        try {
            client.cancel(server.baseUrl(), taskId);
            ConsoleOutput.success("Task " + taskId + " canceled");
            return 0;
        } catch (ClientException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
