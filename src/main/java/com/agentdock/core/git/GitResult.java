package com.agentdock.core.git;

/**
 * Outcome of one git invocation. Output is kept verbatim (not trimmed) so callers
 * such as diff extraction see exactly what git wrote.
 */
public record GitResult(int exitCode, String stdout, String stderr) {

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
