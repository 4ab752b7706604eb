package net.spookly.xrayagent.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class ConfigValidatorTest {
    @Test
    void acceptsCompleteSettings() {
        assertDoesNotThrow(() -> ConfigValidator.validate(validSettings()));
    }

    @Test
    void collectsEveryViolation() {
        AgentSettings settings = validSettings();
        settings.agent.serverId = 0L;
        settings.agent.apiKey = " ";
        settings.coreApi.url = "ftp://core.example.com";
        settings.server.listen = "no-port";
        settings.xray.testCommand = List.of("xray", "-test");
        settings.logging.level = "loud";

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(settings));

        String message = exception.getMessage();
        assertTrue(message.contains("agent.serverId"));
        assertTrue(message.contains("agent.apiKey is required"));
        assertTrue(message.contains("coreApi.url must be an http(s) URL"));
        assertTrue(message.contains("server.listen is invalid"));
        assertTrue(message.contains("xray.testCommand must reference the candidate file"));
        assertTrue(message.contains("logging.level"));
    }

    @Test
    void rejectsBackoffCapBelowInitialDelay() {
        AgentSettings settings = validSettings();
        settings.coreApi.registration.initialBackoffMs = 5000;
        settings.coreApi.registration.maxBackoffMs = 1000;

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigValidator.validate(settings));

        assertTrue(exception.getMessage().contains("maxBackoffMs"));
    }

    static AgentSettings validSettings() {
        AgentSettings settings = new AgentSettings();
        settings.agent = new AgentSettings.AgentConfig();
        settings.agent.serverId = 3L;
        settings.agent.apiKey = "key";
        settings.coreApi = new AgentSettings.CoreApiConfig();
        settings.coreApi.url = "https://core.example.com";
        settings.xray = new AgentSettings.XrayConfig();
        settings.xray.configPath = "/etc/xray/config.json";
        settings.xray.reloadCommand = List.of("pkill", "-HUP", "xray");
        return ConfigDefaults.applyDefaults(settings);
    }
}
