package net.spookly.xrayagent.endpoint;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import net.spookly.xrayagent.config.AgentSettings;
import net.spookly.xrayagent.model.AgentIdentity;
import net.spookly.xrayagent.model.Command;
import net.spookly.xrayagent.reconcile.CommandQueue;
import net.spookly.xrayagent.reconcile.CommandTicket;
import net.spookly.xrayagent.reconcile.QueueFullException;
import net.spookly.xrayagent.util.ListenAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP interface through which the Core API pushes commands and reads agent state.
 * <p>
 * Commands are acknowledged with 202 once queued; their outcome is read back from
 * {@code GET /commands/{id}}.
 */
public final class CommandServer {
    private static final Logger log = LoggerFactory.getLogger(CommandServer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    private static final String COMMANDS_PATH = "/commands";

    private final AgentIdentity identity;
    private final CommandQueue queue;
    private final StatusSource statusSource;
    private final HttpServer server;
    private final ExecutorService workers;
    private final int maxRequestBytes;
    private final RequestRateLimiter rateLimiter;

    public CommandServer(AgentSettings.ServerConfig config,
                         AgentIdentity identity,
                         CommandQueue queue,
                         StatusSource statusSource) {
        Objects.requireNonNull(config, "config");
        this.identity = Objects.requireNonNull(identity, "identity");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.statusSource = Objects.requireNonNull(statusSource, "statusSource");
        InetSocketAddress socketAddress = ListenAddress.parse(config.listen).toSocketAddress();
        try {
            this.server = HttpServer.create(socketAddress, 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind command listener on " + config.listen, e);
        }
        this.workers = Executors.newFixedThreadPool(config.workerThreads != null ? config.workerThreads : 4);
        this.server.setExecutor(workers);
        this.server.createContext("/health", new HealthHandler());
        this.server.createContext("/status", new StatusHandler());
        this.server.createContext("/metrics", new MetricsHandler());
        this.server.createContext(COMMANDS_PATH, new CommandsHandler());
        this.maxRequestBytes = config.maxRequestBytes != null ? config.maxRequestBytes : 64 * 1024;
        this.rateLimiter = new RequestRateLimiter(config.rateLimitPerMinute != null ? config.rateLimitPerMinute : 0);
    }

    /**
     * Start accepting requests.
     */
    public void start() {
        server.start();
        log.info("Command endpoint listening on {}:{}", server.getAddress().getHostString(), port());
    }

    /**
     * Stop accepting requests. In-flight exchanges get up to one second to finish.
     */
    public void stop() {
        server.stop(1);
        workers.shutdown();
    }

    /**
     * Bound port, useful when listening on port 0.
     */
    public int port() {
        return server.getAddress().getPort();
    }

    private abstract class BaseHandler implements HttpHandler {
        private final boolean authenticated;

        private BaseHandler(boolean authenticated) {
            this.authenticated = authenticated;
        }

        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            try {
                if (authenticated) {
                    if (!rateLimiter.tryAcquire(exchange.getRemoteAddress().getAddress())) {
                        writeResponse(exchange, 429, AgentResponse.error("rate limit exceeded"));
                        return;
                    }
                    String presented = exchange.getRequestHeaders().getFirst(ApiKeyAuth.HEADER);
                    if (!ApiKeyAuth.matches(identity.apiKey(), presented)) {
                        log.warn("Rejected {} {} from {}: invalid API key", exchange.getRequestMethod(),
                                exchange.getRequestURI().getPath(), exchange.getRemoteAddress().getAddress().getHostAddress());
                        writeResponse(exchange, 401, AgentResponse.error("invalid api key"));
                        return;
                    }
                }
                handleRequest(exchange);
            } catch (RequestTooLargeException e) {
                writeResponse(exchange, 413, AgentResponse.error("request too large"));
            } catch (IllegalArgumentException e) {
                writeResponse(exchange, 400, AgentResponse.error(e.getMessage()));
            } catch (Exception e) {
                log.error("Unhandled error serving {} {}", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                writeResponse(exchange, 500, AgentResponse.error("internal error"));
            } finally {
                exchange.close();
            }
        }

        protected abstract void handleRequest(HttpExchange exchange) throws IOException;

        protected boolean requireMethod(HttpExchange exchange, String method) throws IOException {
            if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().add("Allow", method);
                writeResponse(exchange, 405, AgentResponse.error("method not allowed"));
                return false;
            }
            return true;
        }

        protected <T> T readJson(byte[] payload, Class<T> type) throws IOException {
            if (payload == null || payload.length == 0) {
                throw new IllegalArgumentException("request body required");
            }
            try {
                return MAPPER.readValue(payload, type);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("invalid json");
            }
        }

        protected byte[] readBodyBytes(HttpExchange exchange) throws IOException {
            try (InputStream input = exchange.getRequestBody()) {
                if (input == null) {
                    return new byte[0];
                }
                ByteArrayOutputStream output = new ByteArrayOutputStream();
                byte[] buffer = new byte[8192];
                int total = 0;
                int read;
                while ((read = input.read(buffer)) != -1) {
                    total += read;
                    if (total > maxRequestBytes) {
                        throw new RequestTooLargeException();
                    }
                    output.write(buffer, 0, read);
                }
                return output.toByteArray();
            }
        }
    }

    private final class HealthHandler extends BaseHandler {
        private HealthHandler() {
            super(false);
        }

        @Override
        protected void handleRequest(HttpExchange exchange) throws IOException {
            if (!requireMethod(exchange, "GET")) {
                return;
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "healthy");
            body.put("service", "xray-agent");
            writeJson(exchange, 200, body);
        }
    }

    private final class StatusHandler extends BaseHandler {
        private StatusHandler() {
            super(true);
        }

        @Override
        protected void handleRequest(HttpExchange exchange) throws IOException {
            if (!requireMethod(exchange, "GET")) {
                return;
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("server_id", identity.serverId());
            data.put("agent_url", identity.agentUrl());
            data.put("version", AgentIdentity.VERSION);
            data.putAll(statusSource.status());
            data.put("pending_commands", queue.pending());
            writeResponse(exchange, 200, AgentResponse.ok("ok", data));
        }
    }

    private final class MetricsHandler extends BaseHandler {
        private MetricsHandler() {
            super(false);
        }

        @Override
        protected void handleRequest(HttpExchange exchange) throws IOException {
            if (!requireMethod(exchange, "GET")) {
                return;
            }
            byte[] payload = statusSource.prometheus().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
            exchange.sendResponseHeaders(200, payload.length);
            try (OutputStream output = exchange.getResponseBody()) {
                output.write(payload);
            }
        }
    }

    private final class CommandsHandler extends BaseHandler {
        private CommandsHandler() {
            super(true);
        }

        @Override
        protected void handleRequest(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            if (path.equals(COMMANDS_PATH) || path.equals(COMMANDS_PATH + "/")) {
                if (requireMethod(exchange, "POST")) {
                    submit(exchange);
                }
                return;
            }
            String id = path.startsWith(COMMANDS_PATH + "/") ? path.substring(COMMANDS_PATH.length() + 1) : "";
            if (id.isEmpty() || id.contains("/")) {
                writeResponse(exchange, 404, AgentResponse.error("not found"));
                return;
            }
            if (requireMethod(exchange, "GET")) {
                lookup(exchange, id);
            }
        }

        private void submit(HttpExchange exchange) throws IOException {
            CommandRequest request = readJson(readBodyBytes(exchange), CommandRequest.class);
            Command command = request.toCommand();
            CommandTicket ticket;
            try {
                ticket = queue.submit(command);
            } catch (QueueFullException e) {
                log.warn("Rejected {} for {}: {}", command.kind().wireName(), command.userUuid(), e.getMessage());
                writeResponse(exchange, 503, AgentResponse.error(e.getMessage()));
                return;
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("command_id", ticket.id());
            data.put("status", ticket.state().wireName());
            exchange.getResponseHeaders().add("Location", COMMANDS_PATH + "/" + ticket.id());
            writeResponse(exchange, 202, AgentResponse.ok("accepted", data));
        }

        private void lookup(HttpExchange exchange, String id) throws IOException {
            Optional<CommandTicket> ticket = queue.find(id);
            if (ticket.isEmpty()) {
                writeResponse(exchange, 404, AgentResponse.error("unknown command id"));
                return;
            }
            writeResponse(exchange, 200, AgentResponse.ok(ticket.get().state().wireName(), ticket.get().toPayload()));
        }
    }

    private void writeResponse(HttpExchange exchange, int status, AgentResponse response) throws IOException {
        writeJson(exchange, status, response);
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = MAPPER.writeValueAsBytes(body);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream output = exchange.getResponseBody()) {
            output.write(payload);
        }
    }

    private static final class RequestTooLargeException extends RuntimeException {
        private RequestTooLargeException() {
            super("request too large");
        }
    }

    private static final class RequestRateLimiter {
        private static final long WINDOW_MILLIS = 60_000L;
        private final int limitPerMinute;
        private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();

        private RequestRateLimiter(int limitPerMinute) {
            this.limitPerMinute = limitPerMinute;
        }

        private boolean tryAcquire(InetAddress address) {
            if (limitPerMinute <= 0) {
                return true;
            }
            String key = address.getHostAddress();
            long now = System.currentTimeMillis();
            Window window = windows.computeIfAbsent(key, ignore -> new Window(now));
            synchronized (window) {
                if (now - window.windowStart >= WINDOW_MILLIS) {
                    window.windowStart = now;
                    window.count = 0;
                }
                if (window.count >= limitPerMinute) {
                    return false;
                }
                window.count++;
            }
            return true;
        }

        private static final class Window {
            private long windowStart;
            private int count;

            private Window(long windowStart) {
                this.windowStart = windowStart;
            }
        }
    }
}
