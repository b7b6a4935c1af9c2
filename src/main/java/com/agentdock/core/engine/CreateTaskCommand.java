package com.agentdock.core.engine;

import java.util.List;

/**
 * Input for {@link TaskOrchestrator#create}.
 */
public record CreateTaskCommand(String prompt, String command, String title, List<RepoSpec> repos) {

    public CreateTaskCommand {
        repos = repos != null ? List.copyOf(repos) : List.of();
    }
}
