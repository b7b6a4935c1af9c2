package com.agentdock.dispatch.api;

/**
 * Inbound JSON body for POST /tasks/{id}/input.
 */
public record InputRequest(String text, String repoId) {}
