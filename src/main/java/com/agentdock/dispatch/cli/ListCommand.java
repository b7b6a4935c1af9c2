package com.agentdock.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.time.Instant;
import java.util.concurrent.Callable;

/**
 * CLI command: agentdock list
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List tasks, newest first")
@Component
public class ListCommand implements Callable<Integer> {

    @Mixin
    ServerOptions server;

    private final AgentdockClient client;

    public ListCommand(AgentdockClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        JsonNode tasks;
        try {
            tasks = client.listTasks(server.baseUrl());
        } catch (ClientException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        if (tasks.isEmpty()) {
            ConsoleOutput.info("No tasks.");
            return 0;
        }

        System.out.printf("  %-36s %-10s %-6s %-24s %s%n", "TASK", "STATUS", "REPOS", "CREATED", "TITLE");
        System.out.println("  " + "-".repeat(100));
        for (JsonNode task : tasks) {
            System.out.printf("  %-36s %-10s %-6d %-24s %s%n",
                    task.path("id").asText(),
                    task.path("status").asText(),
                    task.path("repos").size(),
                    Instant.ofEpochMilli(task.path("createdAt").asLong()),
                    ConsoleOutput.truncate(task.path("title").asText(), 40));
        }
        return 0;
    }
}
