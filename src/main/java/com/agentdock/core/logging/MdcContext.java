package com.agentdock.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Agentdock-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setRepo(String taskId, String repoId) {
        MDC.put("taskId", taskId);
        MDC.put("repoId", repoId);
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("repoId");
    }
}
