package com.agentdock.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Progress of a single repository within a task.
 *
 * <p>Transitions (happy path): PENDING → PREPARING → READY → RUNNING → DONE.
 * ERROR and CANCELED can be reached from any non-terminal state.
 */
public enum RepoStatus {
    PENDING,
    PREPARING,
    READY,
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

    public boolean isInFlight() {
        return !isTerminal();
    }

    /**
     * Whether a repository in this state may have its process restarted by a resume.
     * Liveness and working-copy existence are checked by the caller.
     */
    public boolean isResumable() {
        return this != DONE && this != CANCELED;
    }
}
