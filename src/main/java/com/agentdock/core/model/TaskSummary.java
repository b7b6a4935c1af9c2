package com.agentdock.core.model;

import java.util.List;

/**
 * Client-facing snapshot of a task, taken under the task's monitor.
 */
public record TaskSummary(
    String id,
    String title,
    TaskStatus status,
    long createdAt,
    long updatedAt,
    String prompt,
    String command,
    List<RepoSummary> repos
) {

    public record RepoSummary(
        String id,
        String name,
        RepoKind type,
        String url,
        String path,
        String branch,
        RepoStatus status,
        Integer exitCode,
        String signal,
        String error,
        String prUrl
    ) {
        static RepoSummary of(RepoEntry repo) {
            return new RepoSummary(repo.getId(), repo.getName(), repo.getType(), repo.getUrl(),
                    repo.getPath(), repo.getBranch(), repo.getStatus(), repo.getExitCode(),
                    repo.getSignal(), repo.getError(), repo.getPrUrl());
        }
    }

    public static TaskSummary of(Task task) {
        synchronized (task) {
            return new TaskSummary(task.getId(), task.getTitle(), task.getStatus(),
                    task.getCreatedAt(), task.getUpdatedAt(), task.getPrompt(), task.getCommand(),
                    task.getRepos().stream().map(RepoSummary::of).toList());
        }
    }
}
