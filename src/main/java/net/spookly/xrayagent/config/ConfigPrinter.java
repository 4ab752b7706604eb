package net.spookly.xrayagent.config;

import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Renders the effective configuration with the shared API key redacted.
 */
public final class ConfigPrinter {
    private static final String REDACTED = "<redacted>";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigPrinter() {
    }

    @SuppressWarnings("unchecked")
    public static String toYaml(AgentSettings settings) {
        Map<String, Object> data = MAPPER.convertValue(settings, Map.class);
        Object agent = data.get("agent");
        if (agent instanceof Map) {
            Map<String, Object> agentMap = (Map<String, Object>) agent;
            if (agentMap.get("apiKey") != null) {
                agentMap.put("apiKey", REDACTED);
            }
        }
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options).dump(data);
    }
}
