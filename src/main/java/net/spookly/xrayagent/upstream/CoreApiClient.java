package net.spookly.xrayagent.upstream;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.spookly.xrayagent.config.AgentSettings;
import net.spookly.xrayagent.endpoint.ApiKeyAuth;
import net.spookly.xrayagent.event.AgentEvent;
import net.spookly.xrayagent.model.AgentIdentity;
import net.spookly.xrayagent.model.MetricsSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CoreApi} over HTTP.
 * <p>
 * Registration goes to {@code /api/v1/servers/{serverId}/agent/register}; events and metrics go
 * to the {@code /api/v1/agents/webhook} endpoint. Every 2xx response is recorded as an
 * acknowledgement.
 */
public final class CoreApiClient implements CoreApi {
    static final String METRICS_EVENT = "metrics";

    private static final Logger log = LoggerFactory.getLogger(CoreApiClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI baseUri;
    private final AgentIdentity identity;
    private final Duration requestTimeout;
    private final UpstreamAckTracker ackTracker;
    private final HttpClient http;

    public CoreApiClient(URI baseUri, AgentIdentity identity, Duration requestTimeout, UpstreamAckTracker ackTracker) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.identity = Objects.requireNonNull(identity, "identity");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.ackTracker = Objects.requireNonNull(ackTracker, "ackTracker");
        this.http = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();
    }

    public static CoreApiClient fromSettings(AgentSettings settings, AgentIdentity identity, UpstreamAckTracker ackTracker) {
        return new CoreApiClient(URI.create(settings.coreApi.url), identity,
                Duration.ofMillis(settings.coreApi.requestTimeoutMs), ackTracker);
    }

    @Override
    public void register() throws CoreApiException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("agent_url", identity.agentUrl());
        body.put("version", AgentIdentity.VERSION);
        HttpRequest request = post("/api/v1/servers/" + identity.serverId() + "/agent/register", body);
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CoreApiException("registration request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CoreApiException("registration interrupted", e);
        }
        check("registration", response);
    }

    @Override
    public CompletableFuture<Void> sendEvent(AgentEvent event) {
        Map<String, Object> data = new LinkedHashMap<>(event.data());
        data.put("timestamp", event.timestamp().toString());
        return webhook(event.type().wireName(), data);
    }

    @Override
    public CompletableFuture<Void> sendMetrics(MetricsSample sample) {
        return webhook(METRICS_EVENT, sample.toPayload());
    }

    private CompletableFuture<Void> webhook(String eventName, Map<String, Object> data) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("event", eventName);
        body.put("server_id", identity.serverId());
        body.put("data", data);
        HttpRequest request;
        try {
            request = post("/api/v1/agents/webhook", body);
        } catch (CoreApiException e) {
            return CompletableFuture.failedFuture(e);
        }
        return http.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .handle((response, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        throw new CompletionException(new CoreApiException(eventName + " push failed: " + cause, cause));
                    }
                    try {
                        check(eventName + " push", response);
                    } catch (CoreApiException e) {
                        throw new CompletionException(e);
                    }
                    return null;
                });
    }

    private HttpRequest post(String path, Map<String, Object> body) throws CoreApiException {
        byte[] payload;
        try {
            payload = MAPPER.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new CoreApiException("Failed to encode request body", e);
        }
        return HttpRequest.newBuilder(resolve(path))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header(ApiKeyAuth.HEADER, identity.apiKey())
                .POST(HttpRequest.BodyPublishers.ofByteArray(payload))
                .build();
    }

    private void check(String label, HttpResponse<String> response) throws CoreApiException {
        int status = response.statusCode();
        if (status / 100 != 2) {
            throw new CoreApiException(label + " returned " + status, status);
        }
        ackTracker.recordAck();
        log.debug("{} acknowledged with {}", label, status);
    }

    URI resolve(String path) {
        String base = baseUri.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + path);
    }
}
