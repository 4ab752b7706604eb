package net.spookly.xrayagent.upstream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import net.spookly.xrayagent.event.AgentEvent;
import net.spookly.xrayagent.event.AgentEventType;
import net.spookly.xrayagent.model.AgentIdentity;
import net.spookly.xrayagent.model.MetricsSample;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CoreApiClientTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<Recorded> requests = new CopyOnWriteArrayList<>();
    private volatile int responseStatus = 200;
    private HttpServer core;
    private UpstreamAckTracker ackTracker;
    private CoreApiClient client;

    @BeforeEach
    void setUp() throws IOException {
        core = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        core.createContext("/", exchange -> {
            byte[] body;
            try (InputStream input = exchange.getRequestBody()) {
                body = input.readAllBytes();
            }
            requests.add(new Recorded(exchange.getRequestMethod(), exchange.getRequestURI().getPath(),
                    exchange.getRequestHeaders().getFirst("X-API-Key"), MAPPER.readTree(body)));
            byte[] reply = "{}".getBytes();
            exchange.sendResponseHeaders(responseStatus, reply.length);
            try (OutputStream output = exchange.getResponseBody()) {
                output.write(reply);
            }
        });
        core.start();
        ackTracker = new UpstreamAckTracker();
        URI base = URI.create("http://127.0.0.1:" + core.getAddress().getPort() + "/");
        client = new CoreApiClient(base, new AgentIdentity(42, "core-key", "http://10.0.0.5:8080"),
                Duration.ofSeconds(5), ackTracker);
    }

    @AfterEach
    void tearDown() {
        core.stop(0);
    }

    @Test
    void registerPostsAgentUrlWithApiKey() throws Exception {
        client.register();

        assertEquals(1, requests.size());
        Recorded request = requests.get(0);
        assertEquals("POST", request.method);
        assertEquals("/api/v1/servers/42/agent/register", request.path);
        assertEquals("core-key", request.apiKey);
        assertEquals("http://10.0.0.5:8080", request.body.path("agent_url").asText());
        assertEquals(AgentIdentity.VERSION, request.body.path("version").asText());
        assertTrue(ackTracker.lastAck().isPresent());
    }

    @Test
    void rejectedRegistrationCarriesStatus() {
        responseStatus = 503;

        CoreApiException error = assertThrows(CoreApiException.class, () -> client.register());

        assertEquals(503, error.statusCode());
        assertFalse(ackTracker.lastAck().isPresent());
    }

    @Test
    void eventsGoToWebhook() throws Exception {
        client.sendEvent(AgentEvent.of(AgentEventType.XRAY_STOPPED, Map.of("previous", "up")))
                .get(5, TimeUnit.SECONDS);

        Recorded request = requests.get(0);
        assertEquals("/api/v1/agents/webhook", request.path);
        assertEquals("xray_stopped", request.body.path("event").asText());
        assertEquals(42, request.body.path("server_id").asInt());
        assertEquals("up", request.body.path("data").path("previous").asText());
        assertTrue(request.body.path("data").has("timestamp"));
    }

    @Test
    void metricsUseMetricsEvent() throws Exception {
        MetricsSample sample = new MetricsSample(Instant.parse("2026-01-01T00:00:00Z"), 3, true, 0.5, 3600L,
                Map.of("user>>>a@example.com>>>traffic>>>uplink", 100L));

        client.sendMetrics(sample).get(5, TimeUnit.SECONDS);

        JsonNode data = requests.get(0).body.path("data");
        assertEquals(CoreApiClient.METRICS_EVENT, requests.get(0).body.path("event").asText());
        assertEquals(3, data.path("users_count").asInt());
        assertEquals(100, data.path("uplink_bytes").asLong());
        assertEquals(3600, data.path("uptime").asLong());
    }

    @Test
    void failedPushCompletesExceptionally() {
        responseStatus = 500;

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> client.sendEvent(AgentEvent.of(AgentEventType.AGENT_REGISTERED, Map.of()))
                        .get(5, TimeUnit.SECONDS));

        CoreApiException cause = assertInstanceOf(CoreApiException.class, error.getCause());
        assertEquals(500, cause.statusCode());
    }

    @Test
    void unreachableCoreIsReportedAsCoreApiException() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        CoreApiClient unreachable = new CoreApiClient(URI.create("http://127.0.0.1:" + closedPort),
                new AgentIdentity(42, "core-key", "http://10.0.0.5:8080"), Duration.ofSeconds(2), ackTracker);

        CoreApiException error = assertThrows(CoreApiException.class, unreachable::register);

        assertEquals(-1, error.statusCode());
    }

    @Test
    void resolveJoinsBaseAndPath() {
        CoreApiClient withPrefix = new CoreApiClient(URI.create("https://core.example.com/panel/"),
                new AgentIdentity(1, "k", "http://a"), Duration.ofSeconds(1), ackTracker);

        assertEquals("https://core.example.com/panel/api/v1/agents/webhook",
                withPrefix.resolve("/api/v1/agents/webhook").toString());
    }

    private static final class Recorded {
        private final String method;
        private final String path;
        private final String apiKey;
        private final JsonNode body;

        private Recorded(String method, String path, String apiKey, JsonNode body) {
            this.method = method;
            this.path = path;
            this.apiKey = apiKey;
            this.body = body;
        }
    }
}
