package com.agentdock.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Where a repository's source comes from.
 */
public enum RepoKind {
    /** An existing checkout on this host; prepared as a linked worktree. */
    LOCAL,
    /** A remote URL; prepared by cloning. */
    GIT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public static Optional<RepoKind> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (RepoKind kind : values()) {
            if (kind.wireName().equalsIgnoreCase(value.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
