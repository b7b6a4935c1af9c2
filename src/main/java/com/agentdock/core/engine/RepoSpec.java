package com.agentdock.core.engine;

/**
 * A repository as submitted by a client, before validation and defaulting.
 *
 * @param id   optional; defaults to {@code repo<N>} by 1-based position
 * @param name optional; defaults to the id
 * @param type {@code local} or {@code git}; defaults to {@code git} when a URL is given
 * @param path local source checkout
 * @param url  remote to clone
 */
public record RepoSpec(String id, String name, String type, String path, String url) {
}
