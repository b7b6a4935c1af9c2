package com.agentdock.core.events;

/**
 * Receives events for a single task, in sequence order, on the subscription's own thread.
 * A listener that throws is detached from the log.
 */
@FunctionalInterface
public interface TaskEventListener {
    void deliver(TaskEvent event) throws Exception;
}
