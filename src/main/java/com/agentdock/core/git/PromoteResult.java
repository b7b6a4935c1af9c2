package com.agentdock.core.git;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Per-repository outcome of a promotion.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PromoteResult(
    String repoId,
    boolean ok,
    Boolean skipped,
    Boolean pushed,
    Boolean prSkipped,
    String prUrl,
    String message
) {

    public static PromoteResult skipped(String repoId) {
        return new PromoteResult(repoId, true, true, null, null, null, null);
    }

    public static PromoteResult pushed(String repoId) {
        return new PromoteResult(repoId, true, null, true, null, null, null);
    }

    public static PromoteResult pushedWithoutPr(String repoId) {
        return new PromoteResult(repoId, true, null, true, true, null, null);
    }

    public static PromoteResult pullRequest(String repoId, String prUrl) {
        return new PromoteResult(repoId, true, null, null, null, prUrl, null);
    }

    public static PromoteResult failed(String repoId, String message) {
        return new PromoteResult(repoId, false, null, null, null, null, message);
    }
}
