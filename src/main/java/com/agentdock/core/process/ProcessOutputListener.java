package com.agentdock.core.process;

/**
 * Callbacks from a {@link RunningProcess}. Invoked on the process's pump threads.
 */
public interface ProcessOutputListener {

    /** A chunk of decoded output; {@code stream} is {@code stdout} or {@code stderr}. */
    void onOutput(String stream, String text);

    /** Called once, after both output streams are drained. */
    void onExit(ExitStatus status);
}
