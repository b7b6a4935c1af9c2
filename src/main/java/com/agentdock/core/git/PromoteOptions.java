package com.agentdock.core.git;

/**
 * Caller overrides for a promotion. Blank values fall back to defaults.
 */
public record PromoteOptions(String message, String prTitle, String prBody) {

    public static PromoteOptions defaults() {
        return new PromoteOptions(null, null, null);
    }
}
