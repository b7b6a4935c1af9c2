package com.agentdock.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: agentdock status &lt;task-id&gt;
 * <p>
 * Shows a task and its repositories. With {@code --watch} the task's event feed is
 * replayed from {@code --since} and followed live until interrupted.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show task status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Mixin
    ServerOptions server;

    @Parameters(index = "0", description = "Task ID")
    String taskId;

    @Option(names = {"--watch", "-w"}, description = "Watch for live updates via SSE")
    boolean watch;

    @Option(names = {"--since"}, description = "Replay events after this sequence number (default: ${DEFAULT-VALUE})",
            defaultValue = "0")
    long since;

    private final AgentdockClient client;

    public StatusCommand(AgentdockClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        try {
            if (watch) {
                ConsoleOutput.info("Watching task " + taskId + " at " + server.baseUrl() + "...");
                client.streamEvents(server.baseUrl(), taskId, since, ConsoleOutput::event);
                System.out.println();
                ConsoleOutput.info("Stream ended.");
                return 0;
            }
            printTask(client.getTask(server.baseUrl(), taskId));
            return 0;
        } catch (ClientException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }

    private static void printTask(JsonNode task) {
        System.out.println();
        System.out.println("TASK " + task.path("id").asText());
        System.out.println("Title:   " + task.path("title").asText());
        System.out.println("Command: " + task.path("command").asText());
        System.out.println("Status:  " + ConsoleOutput.status(task.path("status").asText()));

        System.out.println();
        System.out.printf("  %-16s %-6s %-10s %-6s %s%n", "REPO", "TYPE", "STATUS", "EXIT", "BRANCH / PR");
        System.out.println("  " + "-".repeat(72));
        for (JsonNode repo : task.path("repos")) {
            String exit = repo.path("exitCode").isNumber()
                    ? repo.path("exitCode").asText()
                    : repo.path("signal").asText("-");
            String target = repo.hasNonNull("prUrl") ? repo.path("prUrl").asText() : repo.path("branch").asText("-");
            System.out.printf("  %-16s %-6s %-10s %-6s %s%n",
                    ConsoleOutput.truncate(repo.path("id").asText(), 16),
                    repo.path("type").asText(),
                    repo.path("status").asText(),
                    exit,
                    target);
            if (repo.hasNonNull("error")) {
                ConsoleOutput.error("  " + repo.path("id").asText() + ": " + repo.path("error").asText());
            }
        }
    }
}
