package com.agentdock.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: agentdock promote &lt;task-id&gt;
 * <p>
 * Commits, pushes and opens pull requests for every repository of the task,
 * or only for {@code --repo}.
 */
@Command(name = "promote", mixinStandardHelpOptions = true, description = "Commit, push and open pull requests")
@Component
public class PromoteCommand implements Callable<Integer> {

    @Mixin
    ServerOptions server;

    @Parameters(index = "0", description = "Task ID")
    String taskId;

    @Option(names = {"--repo", "-r"}, description = "Promote only this repository")
    String repoId;

    @Option(names = {"--message", "-m"}, description = "Commit message")
    String message;

    @Option(names = {"--pr-title"}, description = "Pull request title (defaults to the commit message)")
    String prTitle;

    @Option(names = {"--pr-body"}, description = "Pull request body (defaults to the prompt)")
    String prBody;

    private final AgentdockClient client;

    public PromoteCommand(AgentdockClient client) {
        this.client = client;
    }

    @Override
    public Integer call() {
        Map<String, Object> body = new LinkedHashMap<>();
        if (message != null) body.put("message", message);
        if (prTitle != null) body.put("prTitle", prTitle);
        if (prBody != null) body.put("prBody", prBody);

        JsonNode results;
        try {
            results = client.promote(server.baseUrl(), taskId, repoId, body);
        } catch (ClientException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        int failed = 0;
        for (JsonNode result : results) {
            String id = result.path("repoId").asText();
            if (!result.path("ok").asBoolean()) {
                failed++;
                ConsoleOutput.error(id + ": " + result.path("message").asText("promote failed"));
            } else if (result.path("skipped").asBoolean()) {
                ConsoleOutput.info(id + ": nothing to commit");
            } else if (result.hasNonNull("prUrl")) {
                ConsoleOutput.success(id + ": " + result.path("prUrl").asText());
            } else if (result.path("prSkipped").asBoolean()) {
                ConsoleOutput.success(id + ": pushed (no GitHub token, pull request skipped)");
            } else {
                ConsoleOutput.success(id + ": pushed");
            }
        }
        return failed == 0 ? 0 : 1;
    }
}
