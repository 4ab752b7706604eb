package net.spookly.xrayagent.xray;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Named counters read from the proxy's stats service.
 */
public final class ProxyStats {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    public static final ProxyStats EMPTY = new ProxyStats(Map.of());

    private final Map<String, Long> counters;

    public ProxyStats(Map<String, Long> counters) {
        this.counters = Collections.unmodifiableMap(new LinkedHashMap<>(counters));
    }

    public Map<String, Long> counters() {
        return counters;
    }

    /**
     * Parse {@code statsquery} output: {@code {"stat":[{"name":"...","value":"123"}]}}.
     * Counters without a value are zero; the service omits them after a reset.
     */
    public static ProxyStats parse(String json) throws IOException {
        if (json == null || json.isBlank()) {
            return EMPTY;
        }
        JsonNode root = MAPPER.readTree(json);
        JsonNode stats = root.path("stat");
        if (!stats.isArray()) {
            if (root.isObject() && root.size() == 0) {
                return EMPTY;
            }
            throw new IOException("stats output has no 'stat' array");
        }
        Map<String, Long> counters = new LinkedHashMap<>();
        for (JsonNode stat : stats) {
            String name = stat.path("name").asText(null);
            if (name == null || name.isEmpty()) {
                continue;
            }
            JsonNode value = stat.path("value");
            long parsed = value.isNumber() ? value.asLong() : parseLong(value.asText("0"));
            counters.put(name, parsed);
        }
        return new ProxyStats(counters);
    }

    private static long parseLong(String raw) throws IOException {
        if (raw.isEmpty()) {
            return 0L;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IOException("stats value is not numeric: " + raw, e);
        }
    }
}
