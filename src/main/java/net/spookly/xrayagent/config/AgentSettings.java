package net.spookly.xrayagent.config;

import java.util.List;

public class AgentSettings {
    public AgentConfig agent;
    public ServerConfig server;
    public CoreApiConfig coreApi;
    public XrayConfig xray;
    public ReconcileConfig reconcile;
    public MonitoringConfig monitoring;
    public LoggingConfig logging;

    public static class AgentConfig {
        public Long serverId;
        public String apiKey;
        /**
         * URL the Core API uses to reach this agent. Defaults to the listen address.
         */
        public String url;
    }

    public static class ServerConfig {
        public String listen;
        public Integer maxRequestBytes;
        public Integer rateLimitPerMinute;
        public Integer workerThreads;
    }

    public static class CoreApiConfig {
        public String url;
        public Integer requestTimeoutMs;
        public RegistrationConfig registration;
    }

    public static class RegistrationConfig {
        public Integer initialBackoffMs;
        public Integer maxBackoffMs;
        public Integer reregisterAfterSeconds;
    }

    public static class XrayConfig {
        public String configPath;
        public String scratchDir;
        public String inboundTag;
        public String userFlow;
        public List<String> testCommand;
        public List<String> reloadCommand;
        public List<String> statsCommand;
        public String apiAddress;
        public Integer commandTimeoutMs;
        public Boolean reloadOnStartup;
    }

    public static class ReconcileConfig {
        public Integer storageRetries;
        public Integer storageRetryBackoffMs;
        public Integer operationTimeoutMs;
        public Integer queueCapacity;
    }

    public static class MonitoringConfig {
        public Integer healthIntervalSeconds;
        public Integer failureThreshold;
        public Integer metricsIntervalSeconds;
    }

    public static class LoggingConfig {
        public String level;
    }
}
