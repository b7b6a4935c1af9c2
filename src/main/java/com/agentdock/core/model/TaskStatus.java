package com.agentdock.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;

/**
 * Lifecycle of a {@link Task}.
 *
 * <p>Transitions: QUEUED → RUNNING → {DONE, ERROR, CANCELED}.
 * Only {@link #derive} decides the outcome once preparation has started.
 */
public enum TaskStatus {
    QUEUED,
    RUNNING,
    DONE,
    ERROR,
    CANCELED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this == DONE || this == ERROR || this == CANCELED;
    }

    /**
     * Derives the task status from its repositories.
     *
     * @param repos         repository entries of the task
     * @param liveProcesses number of child processes currently alive for the task
     * @return RUNNING while anything is live or still in flight, otherwise ERROR if any
     *         repository failed, CANCELED if any was canceled, else DONE
     */
    public static TaskStatus derive(Collection<RepoEntry> repos, int liveProcesses) {
        if (liveProcesses > 0) {
            return RUNNING;
        }
        if (repos == null || repos.isEmpty()) {
            return DONE;
        }
        if (repos.stream().anyMatch(r -> r.getStatus().isInFlight())) {
            return RUNNING;
        }
        if (repos.stream().anyMatch(r -> r.getStatus() == RepoStatus.ERROR)) {
            return ERROR;
        }
        if (repos.stream().anyMatch(r -> r.getStatus() == RepoStatus.CANCELED)) {
            return CANCELED;
        }
        return DONE;
    }
}
