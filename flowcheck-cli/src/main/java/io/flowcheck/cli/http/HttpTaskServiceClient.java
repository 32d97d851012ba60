package io.flowcheck.cli.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flowcheck.core.service.ServiceResponse;
import io.flowcheck.core.service.TaskDraft;
import io.flowcheck.core.service.TaskServiceClient;
import io.flowcheck.core.service.TaskServiceException;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.logging.Logger;

/// {@link TaskServiceClient} speaking JSON over HTTP to the `/api/v1/tasks` resource.
///
/// | Operation | Request |
/// |-----------|---------|
/// | list | `GET /api/v1/tasks?<query>` |
/// | create | `POST /api/v1/tasks` |
/// | read | `GET /api/v1/tasks/{id}` |
/// | update | `PATCH /api/v1/tasks/{id}` |
/// | delete | `DELETE /api/v1/tasks/{id}` |
///
/// A bearer token, when configured, is sent on every request. Response bodies
/// are decoded with Jackson; a body that is not JSON is kept as raw text.
///
/// @implNote Thread-safe. One {@link HttpClient} is shared by all calls.
public class HttpTaskServiceClient implements TaskServiceClient {

    private static final Logger logger = Logger.getLogger(HttpTaskServiceClient.class.getName());

    static final String TASKS_PATH = "/api/v1/tasks";

    private final String baseUrl;
    private final String token;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    /// @param baseUrl server root, e.g. `http://localhost:8080`, not null
    /// @param token bearer token, may be null or blank for none
    /// @param requestTimeout per-request timeout, not null
    /// @param objectMapper JSON codec, not null
    public HttpTaskServiceClient(
            String baseUrl, String token, Duration requestTimeout, ObjectMapper objectMapper) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token = token;
        this.requestTimeout =
                Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.httpClient = HttpClient.newBuilder().connectTimeout(requestTimeout).build();
    }

    @Override
    public ServiceResponse listTasks(Map<String, String> query) {
        StringJoiner params = new StringJoiner("&", "?", "");
        params.setEmptyValue("");
        query.forEach((key, value) -> params.add(encode(key) + "=" + encode(value)));
        return send(request(TASKS_PATH + params).GET());
    }

    @Override
    public ServiceResponse createTask(TaskDraft draft) {
        return send(request(TASKS_PATH).POST(jsonBody(draft.toPayload())));
    }

    @Override
    public ServiceResponse getTask(String id) {
        return send(request(taskPath(id)).GET());
    }

    @Override
    public ServiceResponse updateTask(String id, Map<String, Object> changes) {
        return send(request(taskPath(id)).method("PATCH", jsonBody(changes)));
    }

    @Override
    public ServiceResponse deleteTask(String id) {
        return send(request(taskPath(id)).DELETE());
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    private static String taskPath(String id) {
        return TASKS_PATH + "/" + encode(id);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private HttpRequest.Builder request(String path) {
        var builder =
                HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + path))
                        .timeout(requestTimeout)
                        .header("Accept", "application/json");
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder;
    }

    private HttpRequest.BodyPublisher jsonBody(Object payload) {
        try {
            return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to encode request body: " + e.getMessage(), e);
        }
    }

    private ServiceResponse send(HttpRequest.Builder builder) {
        HttpRequest request = builder.header("Content-Type", "application/json").build();
        try {
            HttpResponse<String> response =
                    httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            logger.fine(request.method() + " " + request.uri() + " -> " + response.statusCode());
            return new ServiceResponse(response.statusCode(), decode(response.body()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskServiceException("Request interrupted: " + request.uri(), e);
        } catch (IOException e) {
            throw new TaskServiceException(
                    "Failed to reach task service at " + baseUrl + ": " + e.getMessage(), e);
        }
    }

    private Object decode(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, Object.class);
        } catch (JsonProcessingException e) {
            logger.fine("Response body is not JSON: " + e.getOriginalMessage());
            return body;
        }
    }
}
