package com.agentdock.core.engine;

/**
 * A client request that is well-formed JSON but semantically invalid.
 */
public class TaskRequestException extends RuntimeException {

    public TaskRequestException(String message) {
        super(message);
    }
}
