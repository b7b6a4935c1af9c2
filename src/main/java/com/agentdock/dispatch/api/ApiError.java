package com.agentdock.dispatch.api;

/**
 * Error envelope shared by every endpoint: {@code {"ok":false,"code":...,"message":...}}.
 */
public record ApiError(boolean ok, String code, String message) {

    public static ApiError of(String code, String message) {
        return new ApiError(false, code, message);
    }
}
