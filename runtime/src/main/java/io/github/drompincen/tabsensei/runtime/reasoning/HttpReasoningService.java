package io.github.drompincen.tabsensei.runtime.reasoning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.tabsensei.protocol.api.AlertsResponse;
import io.github.drompincen.tabsensei.protocol.api.HealthStatus;
import io.github.drompincen.tabsensei.protocol.api.PriceAlert;
import io.github.drompincen.tabsensei.protocol.api.PriceWatch;
import io.github.drompincen.tabsensei.protocol.api.ReasoningReply;
import io.github.drompincen.tabsensei.protocol.transcript.TranscriptMessage;
import io.github.drompincen.tabsensei.runtime.config.EngineSettings;
import io.github.drompincen.tabsensei.runtime.error.ReasoningServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@Service
public class HttpReasoningService implements ReasoningService {

    private static final Logger log = LoggerFactory.getLogger(HttpReasoningService.class);
    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(3);

    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final EngineSettings settings;

    @Autowired
    public HttpReasoningService(ObjectMapper objectMapper, EngineSettings settings) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), objectMapper, settings);
    }

    HttpReasoningService(HttpClient client, ObjectMapper objectMapper, EngineSettings settings) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    @Override
    public CompletableFuture<ReasoningReply> query(String query, List<TranscriptMessage> transcript) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("query", query);
        body.set("transcript", objectMapper.valueToTree(transcript));
        return post("/query", body, settings.reasoningTimeout())
                .thenApply(json -> convert(json, ReasoningReply.class));
    }

    @Override
    public CompletableFuture<Optional<String>> currentEpoch() {
        return get("/health", HEALTH_TIMEOUT)
                .thenApply(json -> Optional.ofNullable(convert(json, HealthStatus.class).sessionEpoch())
                        .filter(epoch -> !epoch.isBlank()))
                .exceptionally(e -> {
                    log.debug("Reasoning service unreachable: {}", rootMessage(e));
                    return Optional.empty();
                });
    }

    @Override
    public CompletableFuture<List<PriceAlert>> unreadAlerts() {
        return get("/alerts", settings.reasoningTimeout())
                .thenApply(json -> convert(json, AlertsResponse.class).alerts());
    }

    @Override
    public CompletableFuture<Boolean> markAlertRead(long alertId) {
        return post("/alerts/" + alertId + "/read", objectMapper.createObjectNode(), settings.reasoningTimeout())
                .thenApply(json -> json.path("ok").asBoolean(false));
    }

    @Override
    public CompletableFuture<Boolean> markAllAlertsRead() {
        return post("/alerts/read-all", objectMapper.createObjectNode(), settings.reasoningTimeout())
                .thenApply(json -> json.path("ok").asBoolean(false));
    }

    @Override
    public CompletableFuture<Boolean> addToWatchlist(PriceWatch watch) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("product", watch.product());
        body.put("url", watch.url());
        body.put("price", watch.price());
        if (watch.threshold() != null) body.put("threshold", watch.threshold());
        return post("/watchlist/add", body, settings.reasoningTimeout())
                .thenApply(json -> json.path("ok").asBoolean(false));
    }

    private CompletableFuture<JsonNode> get(String path, Duration deadline) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(resolve(path))
                .timeout(deadline)
                .header("Accept", "application/json")
                .GET()
                .build();
        return send(request);
    }

    private CompletableFuture<JsonNode> post(String path, JsonNode body, Duration deadline) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(new ReasoningServiceException("Cannot encode request", e));
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(resolve(path))
                .timeout(deadline)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        return send(request);
    }

    private CompletableFuture<JsonNode> send(HttpRequest request) {
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        throw new CompletionException(new ReasoningServiceException(
                                request.method() + " " + request.uri().getPath() + " failed: " + rootMessage(error),
                                error));
                    }
                    if (response.statusCode() >= 400) {
                        throw new CompletionException(new ReasoningServiceException(
                                "Reasoning service error " + response.statusCode(), response.statusCode()));
                    }
                    try {
                        return objectMapper.readTree(response.body());
                    } catch (Exception e) {
                        throw new CompletionException(new ReasoningServiceException("Malformed reply body", e));
                    }
                });
    }

    private <T> T convert(JsonNode json, Class<T> type) {
        try {
            return objectMapper.treeToValue(json, type);
        } catch (Exception e) {
            throw new ReasoningServiceException("Unexpected " + type.getSimpleName() + " body", e);
        }
    }

    private URI resolve(String path) {
        String base = settings.reasoningBaseUrl().toString();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        return URI.create(base + path);
    }

    static String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null && cause.getCause() != cause) cause = cause.getCause();
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
