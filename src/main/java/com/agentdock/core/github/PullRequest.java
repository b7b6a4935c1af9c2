package com.agentdock.core.github;

/**
 * Body of a create-pull-request call.
 */
public record PullRequest(String title, String head, String base, String body, boolean draft) {

    public PullRequest(String title, String head, String base, String body) {
        this(title, head, base, body, false);
    }
}
