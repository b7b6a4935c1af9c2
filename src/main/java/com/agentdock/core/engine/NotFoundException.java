package com.agentdock.core.engine;

/**
 * A task, repository or artifact that the caller addressed does not exist (yet).
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
