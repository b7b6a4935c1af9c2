package com.agentdock.core.github;

/**
 * Non-2xx or unparseable response from the GitHub REST API.
 * The message has the form {@code github_api_<status>}.
 */
public class GitHubApiException extends RuntimeException {

    private final int statusCode;
    private final String responseBody;

    public GitHubApiException(int statusCode, String responseBody) {
        super("github_api_" + statusCode);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public GitHubApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.responseBody = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
