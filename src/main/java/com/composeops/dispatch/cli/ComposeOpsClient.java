package com.composeops.dispatch.cli;

import com.composeops.core.streaming.StreamEvents;
import com.composeops.dispatch.api.OperationDetail;
import com.composeops.dispatch.api.OperationSummary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.stream.Stream;

/**
 * HTTP client for a running ComposeOps server, used by the CLI commands.
 */
@Component
public class ComposeOpsClient {

    private static final Logger log = LoggerFactory.getLogger(ComposeOpsClient.class);

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    private final ObjectMapper objectMapper;
    private final String serverUrl;

    public ComposeOpsClient(ObjectMapper objectMapper,
                            @Value("${composeops.cli.server-url:http://localhost:8080}") String serverUrl) {
        this.objectMapper = objectMapper;
        this.serverUrl = serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
    }

    public String serverUrl() {
        return serverUrl;
    }

    public List<OperationSummary> listOperations(String status, Integer limit) throws IOException, InterruptedException {
        var query = new ArrayList<String>();
        if (status != null) {
            query.add("status=" + URLEncoder.encode(status, StandardCharsets.UTF_8));
        }
        if (limit != null) {
            query.add("limit=" + limit);
        }
        String path = "/api/v1/operations" + (query.isEmpty() ? "" : "?" + String.join("&", query));
        HttpResponse<String> response = send(get(path));
        requireSuccess(response);
        return objectMapper.readValue(response.body(), new TypeReference<List<OperationSummary>>() {});
    }

    public Optional<OperationDetail> getOperation(String operationId) throws IOException, InterruptedException {
        HttpResponse<String> response = send(get("/api/v1/operations/" + encode(operationId)));
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        requireSuccess(response);
        return Optional.of(objectMapper.readValue(response.body(), OperationDetail.class));
    }

    /**
     * Fetches the server health report. A 503 is a valid answer, not an error.
     */
    public HealthReport health() throws IOException, InterruptedException {
        HttpResponse<String> response = send(get("/api/v1/health"));
        if (response.statusCode() != 200 && response.statusCode() != 503) {
            requireSuccess(response);
        }
        return new HealthReport(response.statusCode() == 200, objectMapper.readTree(response.body()));
    }

    /**
     * Opens an SSE connection, subscribes to the operation and streams its log until the
     * stream ends. Every received event, including {@code connected}, is passed to
     * {@code listener} as (event name, data).
     */
    public void watchOperation(String operationId, BiConsumer<String, String> listener)
            throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(serverUrl + "/api/v1/events/stream"))
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        HttpResponse<Stream<String>> response = httpClient.send(request, HttpResponse.BodyHandlers.ofLines());
        if (response.statusCode() != 200) {
            response.body().close();
            throw new ComposeOpsClientException(response.statusCode(), "Server returned HTTP " + response.statusCode());
        }

        try (Stream<String> lines = response.body()) {
            Iterator<String> it = lines.iterator();
            String eventName = "";
            var data = new StringBuilder();
            while (it.hasNext()) {
                String line = it.next();
                if (line.isEmpty()) {
                    if (!eventName.isEmpty() || data.length() > 0) {
                        String name = eventName.isEmpty() ? "message" : eventName;
                        String payload = data.toString();
                        if ("connected".equals(name)) {
                            follow(connectionIdFrom(payload), operationId);
                        }
                        listener.accept(name, payload);
                        if (StreamEvents.STREAM_COMPLETE.equals(name) || StreamEvents.LOG_ERROR.equals(name)) {
                            return;
                        }
                    }
                    eventName = "";
                    data.setLength(0);
                } else if (line.startsWith("event:")) {
                    eventName = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    if (data.length() > 0) {
                        data.append('\n');
                    }
                    String value = line.substring(5);
                    data.append(value.startsWith(" ") ? value.substring(1) : value);
                }
                // lines starting with ':' are heartbeats
            }
        }
        log.debug("Event stream for operation {} closed by server", operationId);
    }

    private void follow(String connectionId, String operationId) throws IOException, InterruptedException {
        String base = "/api/v1/connections/" + encode(connectionId);
        requireSuccess(send(HttpRequest.newBuilder()
                .uri(URI.create(serverUrl + base + "/subscriptions/" + encode(operationId)))
                .PUT(HttpRequest.BodyPublishers.noBody())
                .build()));
        requireSuccess(send(HttpRequest.newBuilder()
                .uri(URI.create(serverUrl + base + "/streams/operations/" + encode(operationId)))
                .POST(HttpRequest.BodyPublishers.noBody())
                .build()));
    }

    String connectionIdFrom(String payload) throws IOException {
        JsonNode node = objectMapper.readTree(payload);
        String connectionId = node.path("connectionId").asText("");
        if (connectionId.isEmpty()) {
            throw new IOException("connected event carried no connection id");
        }
        return connectionId;
    }

    private HttpRequest get(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(serverUrl + path))
                .header("Accept", "application/json")
                .GET()
                .build();
    }

    private HttpResponse<String> send(HttpRequest request) throws IOException, InterruptedException {
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private void requireSuccess(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return;
        }
        String message = "Server returned HTTP " + status;
        String body = response.body();
        if (body != null && !body.isBlank()) {
            try {
                JsonNode error = objectMapper.readTree(body).path("error");
                if (!error.isMissingNode()) {
                    message = error.asText();
                }
            } catch (JsonProcessingException e) {
                log.debug("Error response was not JSON: {}", e.getOriginalMessage());
            }
        }
        throw new ComposeOpsClientException(status, message);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /**
     * @param healthy true when the server reported every component up
     * @param body    the raw health document
     */
    public record HealthReport(boolean healthy, JsonNode body) {}
}
