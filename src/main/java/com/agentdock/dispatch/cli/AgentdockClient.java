package com.agentdock.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * HTTP client for the task API, used by the CLI subcommands.
 */
@Component
public class AgentdockClient {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public AgentdockClient(ObjectMapper objectMapper) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(), objectMapper);
    }

    AgentdockClient(HttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public JsonNode createTask(String baseUrl, Map<String, Object> body) {
        return post(baseUrl + "/tasks", body).path("task");
    }

    public JsonNode listTasks(String baseUrl) {
        return get(baseUrl + "/tasks").path("tasks");
    }

    public JsonNode getTask(String baseUrl, String taskId) {
        return get(baseUrl + "/tasks/" + encode(taskId)).path("task");
    }

    public void cancel(String baseUrl, String taskId) {
        post(baseUrl + "/tasks/" + encode(taskId) + "/cancel", Map.of());
    }

    public void resume(String baseUrl, String taskId) {
        post(baseUrl + "/tasks/" + encode(taskId) + "/resume", Map.of());
    }

    public void sendInput(String baseUrl, String taskId, String repoId, String text) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", text);
        if (repoId != null) body.put("repoId", repoId);
        post(baseUrl + "/tasks/" + encode(taskId) + "/input", body);
    }

    /**
     * Promotes one repository when {@code repoId} is set, otherwise every repository.
     * Returns the list of per-repository results in both cases.
     */
    public JsonNode promote(String baseUrl, String taskId, String repoId, Map<String, Object> body) {
        if (repoId == null) {
            return post(baseUrl + "/tasks/" + encode(taskId) + "/promote", body).path("results");
        }
        JsonNode single = post(baseUrl + "/tasks/" + encode(taskId) + "/repos/" + encode(repoId) + "/promote", body);
        return objectMapper.createArrayNode().add(single);
    }

    public String diff(String baseUrl, String taskId, String repoId) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/tasks/" + encode(taskId) + "/repos/" + encode(repoId) + "/diff"))
                .timeout(REQUEST_TIMEOUT)
                .GET()
                .build();
        HttpResponse<String> response = send(request, baseUrl);
        if (response.statusCode() != 200) {
            throw toException(response);
        }
        return response.body();
    }

    /**
     * Streams events after {@code since} until the server closes the stream.
     * Heartbeat comments are ignored.
     */
    public void streamEvents(String baseUrl, String taskId, long since, Consumer<JsonNode> onEvent) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/tasks/" + encode(taskId) + "/events?since=" + since))
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        HttpResponse<Stream<String>> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
        } catch (IOException e) {
            throw connectionFailure(baseUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClientException("Interrupted", e);
        }
        if (response.statusCode() != 200) {
            String body;
            try (Stream<String> lines = response.body()) {
                body = String.join("\n", (Iterable<String>) lines::iterator);
            }
            throw toException(response.statusCode(), body);
        }
        try (Stream<String> lines = response.body()) {
            lines.filter(line -> line.startsWith("data:"))
                    .map(line -> line.substring(5).trim())
                    .filter(data -> !data.isEmpty())
                    .forEach(data -> onEvent.accept(readTree(data)));
        }
    }

    private JsonNode get(String url) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json")
                .GET()
                .build();
        return exchange(request, url);
    }

    private JsonNode post(String url, Map<String, Object> body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize request body", e);
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
        return exchange(request, url);
    }

    private JsonNode exchange(HttpRequest request, String url) {
        HttpResponse<String> response = send(request, url);
        if (response.statusCode() >= 400) {
            throw toException(response);
        }
        JsonNode node = readTree(response.body());
        if (node.has("ok") && !node.path("ok").asBoolean() && node.has("code")
                && !"promote_failed".equals(node.path("code").asText())) {
            throw new ClientException(response.statusCode(), node.path("code").asText(),
                    node.path("message").asText());
        }
        return node;
    }

    private HttpResponse<String> send(HttpRequest request, String url) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw connectionFailure(url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClientException("Interrupted", e);
        }
    }

    private ClientException toException(HttpResponse<String> response) {
        return toException(response.statusCode(), response.body());
    }

    private ClientException toException(int status, String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node != null && node.has("code")) {
                return new ClientException(status, node.path("code").asText(), node.path("message").asText());
            }
        } catch (JsonProcessingException e) {
            // not an error envelope; fall through to the raw body
        }
        return new ClientException(status, "http_" + status, body != null && !body.isBlank() ? body.trim() : "HTTP " + status);
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ClientException(0, "invalid_response", "Server returned invalid JSON: " + e.getOriginalMessage());
        }
    }

    private static ClientException connectionFailure(String url, IOException e) {
        String detail = e instanceof ConnectException ? "connection refused" : String.valueOf(e.getMessage());
        return new ClientException("Cannot reach agentdock server at " + url + " (" + detail + ")", e);
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
