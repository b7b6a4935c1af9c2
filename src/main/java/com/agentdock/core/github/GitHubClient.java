package com.agentdock.core.github;

import com.agentdock.core.config.AgentdockProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * HTTP client for the GitHub REST API (only what promotion needs).
 *
 * <p>Authenticates with the configured token as a bearer credential.
 */
public class GitHubClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubClient.class);

    private final AgentdockProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GitHubClient(AgentdockProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Opens a pull request.
     *
     * @return the pull request's {@code html_url}, or an empty string if GitHub omitted it
     * @throws GitHubApiException on a missing token, a transport failure or a non-2xx response
     */
    public String createPullRequest(String owner, String repo, PullRequest pullRequest) {
        String path = "/repos/" + encode(owner) + "/" + encode(repo) + "/pulls";
        JsonNode response = post(path, pullRequest);
        String url = response.path("html_url").asText("");
        log.info("Created pull request {} ({} -> {})", url, pullRequest.head(), pullRequest.base());
        return url;
    }

    JsonNode post(String path, Object body) {
        if (!properties.hasGithubToken()) {
            throw new GitHubApiException("missing_github_token", null);
        }
        try {
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(stripTrailingSlash(properties.getGithub().getApiUrl()) + path))
                    .header("Authorization", "Bearer " + properties.getGithub().getToken())
                    .header("Accept", "application/vnd.github+json")
                    .header("User-Agent", "agentdock")
                    .header("Content-Type", "application/json")
                    .timeout(Duration.ofSeconds(30))
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();

            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                log.warn("GitHub API POST {} failed (HTTP {})", path, status);
                throw new GitHubApiException(status, response.body());
            }
            try {
                return objectMapper.readTree(response.body());
            } catch (IOException e) {
                throw new GitHubApiException(status, response.body());
            }
        } catch (IOException e) {
            throw new GitHubApiException("GitHub API request failed: POST " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitHubApiException("GitHub API request interrupted: POST " + path, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
