package com.agentdock.dispatch.api;

import com.agentdock.core.git.PromoteOptions;

/**
 * Inbound JSON body for the promote endpoints. Every field is optional.
 */
public record PromoteRequest(String message, String prTitle, String prBody) {

    PromoteOptions toOptions() {
        return new PromoteOptions(message, prTitle, prBody);
    }
}
