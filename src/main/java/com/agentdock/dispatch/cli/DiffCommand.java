package com.agentdock.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: agentdock diff &lt;task-id&gt; &lt;repo-id&gt;
 * <p>
 * Prints the captured patch unmodified, so the output can be piped to {@code git apply}.
 */
@Command(name = "diff", mixinStandardHelpOptions = true, description = "Print a repository's captured diff")
@Component
public class DiffCommand implements Callable<Integer> {

    @Mixin
    ServerOptions server;

    @Parameters(index = "0", description = "Task ID")
    String taskId;

    @Parameters(index = "1", description = "Repository ID")
    String repoId;

    private final AgentdockClient client;

    public DiffCommand(AgentdockClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        try {
            System.out.print(client.diff(server.baseUrl(), taskId, repoId));
            System.out.flush();
            return 0;
        } catch (ClientException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
