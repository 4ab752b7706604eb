package net.spookly.xrayagent.config;

import java.util.List;

/**
 * Default configuration template and the fallback values applied to optional settings.
 */
public final class ConfigDefaults {
    public static final String DEFAULT_LISTEN = "0.0.0.0:8080";
    public static final int DEFAULT_MAX_REQUEST_BYTES = 64 * 1024;
    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final int DEFAULT_REQUEST_TIMEOUT_MS = 10_000;
    public static final int DEFAULT_INITIAL_BACKOFF_MS = 2_000;
    public static final int DEFAULT_MAX_BACKOFF_MS = 60_000;
    public static final int DEFAULT_REREGISTER_AFTER_SECONDS = 180;
    public static final String DEFAULT_INBOUND_TAG = "vless";
    public static final String DEFAULT_USER_FLOW = "xtls-rprx-vision";
    public static final String DEFAULT_API_ADDRESS = "127.0.0.1:10085";
    public static final int DEFAULT_COMMAND_TIMEOUT_MS = 10_000;
    public static final int DEFAULT_STORAGE_RETRIES = 3;
    public static final int DEFAULT_STORAGE_RETRY_BACKOFF_MS = 200;
    public static final int DEFAULT_OPERATION_TIMEOUT_MS = 10_000;
    public static final int DEFAULT_QUEUE_CAPACITY = 1000;
    public static final int DEFAULT_HEALTH_INTERVAL_SECONDS = 10;
    public static final int DEFAULT_FAILURE_THRESHOLD = 2;
    public static final int DEFAULT_METRICS_INTERVAL_SECONDS = 30;
    public static final String DEFAULT_LOG_LEVEL = "info";
    public static final String SERVER_ID_ENV = "XRAY_AGENT_SERVER_ID";
    public static final String API_KEY_ENV = "XRAY_AGENT_API_KEY";

    private static final String DEFAULT_YAML_TEMPLATE = """
            # Generated default xray-agent config.
            # Server id and API key are issued by the Core API and read from the environment.
            agent:
              serverId: env:%s
              apiKey: env:%s
              url: http://127.0.0.1:8080

            server:
              listen: 0.0.0.0:8080
              maxRequestBytes: 65536
              rateLimitPerMinute: 0

            coreApi:
              url: https://core.example.com
              requestTimeoutMs: 10000
              registration:
                initialBackoffMs: 2000
                maxBackoffMs: 60000
                reregisterAfterSeconds: 180

            xray:
              configPath: /usr/local/etc/xray/config.json
              inboundTag: vless
              userFlow: xtls-rprx-vision
              testCommand: ["xray", "-test", "-config", "{config}"]
              reloadCommand: ["sh", "-c", "cp -f {config} /usr/local/etc/xray/runtime.json && pkill -HUP -x xray"]
              statsCommand: ["xray", "api", "statsquery", "--server=127.0.0.1:10085"]
              apiAddress: 127.0.0.1:10085
              commandTimeoutMs: 10000
              reloadOnStartup: true

            reconcile:
              storageRetries: 3
              storageRetryBackoffMs: 200
              operationTimeoutMs: 10000
              queueCapacity: 1000

            monitoring:
              healthIntervalSeconds: 10
              failureThreshold: 2
              metricsIntervalSeconds: 30

            logging:
              level: info
            """;

    private ConfigDefaults() {
    }

    /**
     * Render the default configuration template.
     */
    public static String defaultYaml() {
        return DEFAULT_YAML_TEMPLATE.formatted(SERVER_ID_ENV, API_KEY_ENV);
    }

    /**
     * Fill every optional setting that was left out of the file.
     */
    public static AgentSettings applyDefaults(AgentSettings settings) {
        if (settings.agent == null) {
            settings.agent = new AgentSettings.AgentConfig();
        }
        if (settings.server == null) {
            settings.server = new AgentSettings.ServerConfig();
        }
        AgentSettings.ServerConfig server = settings.server;
        server.listen = orDefault(server.listen, DEFAULT_LISTEN);
        server.maxRequestBytes = orDefault(server.maxRequestBytes, DEFAULT_MAX_REQUEST_BYTES);
        server.rateLimitPerMinute = orDefault(server.rateLimitPerMinute, 0);
        server.workerThreads = orDefault(server.workerThreads, DEFAULT_WORKER_THREADS);
        if (isBlank(settings.agent.url)) {
            settings.agent.url = "http://" + server.listen;
        }

        if (settings.coreApi == null) {
            settings.coreApi = new AgentSettings.CoreApiConfig();
        }
        AgentSettings.CoreApiConfig coreApi = settings.coreApi;
        coreApi.requestTimeoutMs = orDefault(coreApi.requestTimeoutMs, DEFAULT_REQUEST_TIMEOUT_MS);
        if (coreApi.registration == null) {
            coreApi.registration = new AgentSettings.RegistrationConfig();
        }
        AgentSettings.RegistrationConfig registration = coreApi.registration;
        registration.initialBackoffMs = orDefault(registration.initialBackoffMs, DEFAULT_INITIAL_BACKOFF_MS);
        registration.maxBackoffMs = orDefault(registration.maxBackoffMs, DEFAULT_MAX_BACKOFF_MS);
        registration.reregisterAfterSeconds = orDefault(registration.reregisterAfterSeconds, DEFAULT_REREGISTER_AFTER_SECONDS);

        if (settings.xray == null) {
            settings.xray = new AgentSettings.XrayConfig();
        }
        AgentSettings.XrayConfig xray = settings.xray;
        xray.inboundTag = orDefault(xray.inboundTag, DEFAULT_INBOUND_TAG);
        if (xray.userFlow == null) {
            xray.userFlow = DEFAULT_USER_FLOW;
        }
        if (xray.testCommand == null || xray.testCommand.isEmpty()) {
            xray.testCommand = List.of("xray", "-test", "-config", "{config}");
        }
        if (xray.statsCommand == null || xray.statsCommand.isEmpty()) {
            xray.statsCommand = List.of("xray", "api", "statsquery", "--server=" + orDefault(xray.apiAddress, DEFAULT_API_ADDRESS));
        }
        xray.apiAddress = orDefault(xray.apiAddress, DEFAULT_API_ADDRESS);
        xray.commandTimeoutMs = orDefault(xray.commandTimeoutMs, DEFAULT_COMMAND_TIMEOUT_MS);
        xray.reloadOnStartup = orDefault(xray.reloadOnStartup, Boolean.TRUE);

        if (settings.reconcile == null) {
            settings.reconcile = new AgentSettings.ReconcileConfig();
        }
        AgentSettings.ReconcileConfig reconcile = settings.reconcile;
        reconcile.storageRetries = orDefault(reconcile.storageRetries, DEFAULT_STORAGE_RETRIES);
        reconcile.storageRetryBackoffMs = orDefault(reconcile.storageRetryBackoffMs, DEFAULT_STORAGE_RETRY_BACKOFF_MS);
        reconcile.operationTimeoutMs = orDefault(reconcile.operationTimeoutMs, DEFAULT_OPERATION_TIMEOUT_MS);
        reconcile.queueCapacity = orDefault(reconcile.queueCapacity, DEFAULT_QUEUE_CAPACITY);

        if (settings.monitoring == null) {
            settings.monitoring = new AgentSettings.MonitoringConfig();
        }
        AgentSettings.MonitoringConfig monitoring = settings.monitoring;
        monitoring.healthIntervalSeconds = orDefault(monitoring.healthIntervalSeconds, DEFAULT_HEALTH_INTERVAL_SECONDS);
        monitoring.failureThreshold = orDefault(monitoring.failureThreshold, DEFAULT_FAILURE_THRESHOLD);
        monitoring.metricsIntervalSeconds = orDefault(monitoring.metricsIntervalSeconds, DEFAULT_METRICS_INTERVAL_SECONDS);

        if (settings.logging == null) {
            settings.logging = new AgentSettings.LoggingConfig();
        }
        settings.logging.level = orDefault(settings.logging.level, DEFAULT_LOG_LEVEL);
        return settings;
    }

    private static <T> T orDefault(T value, T fallback) {
        if (value instanceof String text && text.isBlank()) {
            return fallback;
        }
        return value != null ? value : fallback;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
