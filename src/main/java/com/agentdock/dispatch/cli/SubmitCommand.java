package com.agentdock.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: agentdock submit "&lt;prompt&gt;"
 * <p>
 * Submits a task to a running server. Repositories are given as
 * {@code --repo id=api,path=/src/api} or {@code --repo id=web,url=https://github.com/o/web.git};
 * without any the server uses its workspace checkout.
 */
@Command(name = "submit", mixinStandardHelpOptions = true, description = "Submit a task")
@Component
public class SubmitCommand implements Callable<Integer> {

    @Mixin
    ServerOptions server;

    @Parameters(index = "0", description = "Prompt passed to the agent on stdin")
    String prompt;

    @Option(names = {"--command", "-c"}, description = "Shell command to run in each working copy")
    String command;

    @Option(names = {"--title", "-t"}, description = "Task title")
    String title;

    @Option(names = {"--repo", "-r"}, description = "Repository as key=value pairs (id, name, type, path, url)")
    List<String> repos = new ArrayList<>();

    @Option(names = {"--watch", "-w"}, description = "Stream the task's events after submitting")
    boolean watch;

    private final AgentdockClient client;

    public SubmitCommand(AgentdockClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("prompt", prompt);
        if (command != null) body.put("command", command);
        if (title != null) body.put("title", title);
        if (!repos.isEmpty()) {
            List<Map<String, String>> entries = new ArrayList<>();
            for (String repo : repos) {
                entries.add(parseRepo(repo));
            }
            body.put("repos", entries);
        }

        try {
            JsonNode task = client.createTask(server.baseUrl(), body);
            String taskId = task.path("id").asText();
            ConsoleOutput.success("Task " + taskId + " submitted: " + task.path("title").asText());
            for (JsonNode repo : task.path("repos")) {
                System.out.println("  " + repo.path("id").asText() + " ("
                        + repo.path("type").asText() + ") " + ConsoleOutput.status(repo.path("status").asText()));
            }
            if (watch) {
                client.streamEvents(server.baseUrl(), taskId, 0, ConsoleOutput::event);
            }
            return 0;
        } catch (ClientException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }

    /**
     * Parses {@code id=api,path=/src/api}. A bare value without {@code =} is taken as
     * a URL when it looks like one, otherwise as a local path.
     */
    static Map<String, String> parseRepo(String spec) {
        Map<String, String> repo = new LinkedHashMap<>();
        for (String part : spec.split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) continue;
            int eq = trimmed.indexOf('=');
            if (eq > 0) {
                repo.put(trimmed.substring(0, eq).trim(), trimmed.substring(eq + 1).trim());
            } else if (trimmed.contains("://") || trimmed.startsWith("git@")) {
                repo.put("url", trimmed);
            } else {
                repo.put("path", trimmed);
            }
        }
        return repo;
    }
}
