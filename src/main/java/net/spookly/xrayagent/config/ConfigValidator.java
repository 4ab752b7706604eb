package net.spookly.xrayagent.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

import net.spookly.xrayagent.util.ListenAddress;

public final class ConfigValidator {
    private static final List<String> LOG_LEVELS = List.of("trace", "debug", "info", "warn", "error", "off");

    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(AgentSettings settings) {
        List<String> errors = new ArrayList<>();
        if (settings == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateAgent(settings, errors);
        validateServer(settings, errors);
        validateCoreApi(settings, errors);
        validateXray(settings, errors);
        validateReconcile(settings, errors);
        validateMonitoring(settings, errors);
        validateLogging(settings, errors);

        throwIfErrors(errors);
    }

    private static void validateAgent(AgentSettings settings, List<String> errors) {
        AgentSettings.AgentConfig agent = settings.agent;
        if (agent == null) {
            errors.add("agent section is required");
            return;
        }
        if (agent.serverId == null || agent.serverId <= 0) {
            errors.add("agent.serverId must be greater than 0");
        }
        requireNonBlank(errors, agent.apiKey, "agent.apiKey");
        if (!isBlank(agent.url)) {
            requireHttpUrl(errors, agent.url, "agent.url");
        }
    }

    private static void validateServer(AgentSettings settings, List<String> errors) {
        AgentSettings.ServerConfig server = settings.server;
        if (server == null) {
            errors.add("server section is required");
            return;
        }
        try {
            ListenAddress.parse(server.listen);
        } catch (IllegalArgumentException e) {
            errors.add("server.listen is invalid: " + e.getMessage());
        }
        requirePositive(errors, server.maxRequestBytes, "server.maxRequestBytes");
        requirePositive(errors, server.workerThreads, "server.workerThreads");
        if (server.rateLimitPerMinute != null && server.rateLimitPerMinute < 0) {
            errors.add("server.rateLimitPerMinute must be 0 or greater");
        }
    }

    private static void validateCoreApi(AgentSettings settings, List<String> errors) {
        AgentSettings.CoreApiConfig coreApi = settings.coreApi;
        if (coreApi == null) {
            errors.add("coreApi section is required");
            return;
        }
        if (isBlank(coreApi.url)) {
            errors.add("coreApi.url is required");
        } else {
            requireHttpUrl(errors, coreApi.url, "coreApi.url");
        }
        requirePositive(errors, coreApi.requestTimeoutMs, "coreApi.requestTimeoutMs");
        AgentSettings.RegistrationConfig registration = coreApi.registration;
        if (registration != null) {
            requirePositive(errors, registration.initialBackoffMs, "coreApi.registration.initialBackoffMs");
            requirePositive(errors, registration.maxBackoffMs, "coreApi.registration.maxBackoffMs");
            requirePositive(errors, registration.reregisterAfterSeconds, "coreApi.registration.reregisterAfterSeconds");
            if (registration.initialBackoffMs != null && registration.maxBackoffMs != null
                    && registration.maxBackoffMs < registration.initialBackoffMs) {
                errors.add("coreApi.registration.maxBackoffMs must be >= initialBackoffMs");
            }
        }
    }

    private static void validateXray(AgentSettings settings, List<String> errors) {
        AgentSettings.XrayConfig xray = settings.xray;
        if (xray == null) {
            errors.add("xray section is required");
            return;
        }
        requireNonBlank(errors, xray.configPath, "xray.configPath");
        requireNonBlank(errors, xray.inboundTag, "xray.inboundTag");
        requireCommand(errors, xray.testCommand, "xray.testCommand", true);
        requireCommand(errors, xray.reloadCommand, "xray.reloadCommand", false);
        requireCommand(errors, xray.statsCommand, "xray.statsCommand", false);
        try {
            ListenAddress.parse(xray.apiAddress);
        } catch (IllegalArgumentException e) {
            errors.add("xray.apiAddress is invalid: " + e.getMessage());
        }
        requirePositive(errors, xray.commandTimeoutMs, "xray.commandTimeoutMs");
    }

    private static void validateReconcile(AgentSettings settings, List<String> errors) {
        AgentSettings.ReconcileConfig reconcile = settings.reconcile;
        if (reconcile == null) {
            return;
        }
        requirePositive(errors, reconcile.storageRetries, "reconcile.storageRetries");
        if (reconcile.storageRetryBackoffMs != null && reconcile.storageRetryBackoffMs < 0) {
            errors.add("reconcile.storageRetryBackoffMs must be 0 or greater");
        }
        requirePositive(errors, reconcile.operationTimeoutMs, "reconcile.operationTimeoutMs");
        requirePositive(errors, reconcile.queueCapacity, "reconcile.queueCapacity");
    }

    private static void validateMonitoring(AgentSettings settings, List<String> errors) {
        AgentSettings.MonitoringConfig monitoring = settings.monitoring;
        if (monitoring == null) {
            return;
        }
        requirePositive(errors, monitoring.healthIntervalSeconds, "monitoring.healthIntervalSeconds");
        requirePositive(errors, monitoring.failureThreshold, "monitoring.failureThreshold");
        requirePositive(errors, monitoring.metricsIntervalSeconds, "monitoring.metricsIntervalSeconds");
    }

    private static void validateLogging(AgentSettings settings, List<String> errors) {
        if (settings.logging == null || settings.logging.level == null) {
            return;
        }
        if (!LOG_LEVELS.contains(settings.logging.level.toLowerCase())) {
            errors.add("logging.level must be one of: " + String.join(", ", LOG_LEVELS));
        }
    }

    private static void requireCommand(List<String> errors, List<String> command, String field, boolean requirePlaceholder) {
        if (command == null || command.isEmpty()) {
            errors.add(field + " must include at least one argument");
            return;
        }
        for (String arg : command) {
            if (isBlank(arg)) {
                errors.add(field + " must not include blank arguments");
                return;
            }
        }
        if (requirePlaceholder && command.stream().noneMatch(arg -> arg.contains("{config}"))) {
            errors.add(field + " must reference the candidate file with {config}");
        }
    }

    private static void requireHttpUrl(List<String> errors, String value, String field) {
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || scheme == null
                    || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                errors.add(field + " must be an http(s) URL");
            }
        } catch (URISyntaxException e) {
            errors.add(field + " must be an http(s) URL");
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requirePositive(List<String> errors, Integer value, String field) {
        if (value != null && value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
