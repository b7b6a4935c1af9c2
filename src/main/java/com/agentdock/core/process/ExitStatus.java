package com.agentdock.core.process;

import java.util.Map;

/**
 * How a child process ended: an exit code, or the signal that terminated it.
 *
 * <p>Shells report death-by-signal as {@code 128 + signal number}; for the common
 * signals that is translated back to the signal name with no exit code.
 */
public record ExitStatus(Integer code, String signal) {

    private static final Map<Integer, String> SIGNALS = Map.of(
            1, "SIGHUP",
            2, "SIGINT",
            3, "SIGQUIT",
            6, "SIGABRT",
            9, "SIGKILL",
            13, "SIGPIPE",
            14, "SIGALRM",
            15, "SIGTERM");

    public static ExitStatus from(int exitValue) {
        if (exitValue > 128) {
            String name = SIGNALS.get(exitValue - 128);
            if (name != null) {
                return new ExitStatus(null, name);
            }
        }
        return new ExitStatus(exitValue, null);
    }

    public boolean isSuccess() {
        return code != null && code == 0;
    }
}
