package com.agentdock.dispatch.api;

import com.agentdock.core.engine.CreateTaskCommand;
import com.agentdock.core.engine.TaskRequestException;

import java.util.List;
import java.util.Objects;

/**
 * Inbound JSON body for POST /tasks.
 *
 * @param prompt  instruction fed to the agent on stdin
 * @param command shell command to run; nullable, defaults to the configured agent command
 * @param title   nullable; defaults to the first line of the prompt
 * @param repos   nullable; defaults to the workspace checkout
 */
public record CreateTaskRequest(String prompt, String command, String title, List<RepoRequest> repos) {

    CreateTaskCommand toCommand() {
        List<RepoRequest> entries = repos != null ? repos : List.of();
        if (entries.stream().anyMatch(Objects::isNull)) {
            throw new TaskRequestException("repos must not contain null entries");
        }
        return new CreateTaskCommand(prompt, command, title,
                entries.stream().map(RepoRequest::toSpec).toList());
    }
}
