package com.agentdock.dispatch.api;

import com.agentdock.core.engine.RepoSpec;

/**
 * One entry of {@code repos} in POST /tasks.
 *
 * @param id   optional; defaults to {@code repo<N>}
 * @param name optional display name
 * @param type {@code local} or {@code git}; nullable, inferred from {@code url}
 * @param path local checkout to branch a worktree from
 * @param url  remote to clone
 */
public record RepoRequest(String id, String name, String type, String path, String url) {

    RepoSpec toSpec() {
        return new RepoSpec(id, name, type, path, url);
    }
}
