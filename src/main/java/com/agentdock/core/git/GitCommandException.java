package com.agentdock.core.git;

/**
 * Thrown when a git command exits non-zero or cannot be started.
 * The message is the command's stderr with credentials masked.
 */
public class GitCommandException extends RuntimeException {

    private final String command;
    private final int exitCode;

    public GitCommandException(String command, int exitCode, String message) {
        super(message);
        this.command = command;
        this.exitCode = exitCode;
    }

    public GitCommandException(String command, String message, Throwable cause) {
        super(message, cause);
        this.command = command;
        this.exitCode = -1;
    }

    /** Masked command line. */
    public String getCommand() {
        return command;
    }

    public int getExitCode() {
        return exitCode;
    }
}
