package net.spookly.xrayagent.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Usage counters collected in one metrics tick.
 */
@Value
@Accessors(fluent = true)
public class MetricsSample {
    private static final String UPLINK_SUFFIX = ">>>traffic>>>uplink";
    private static final String DOWNLINK_SUFFIX = ">>>traffic>>>downlink";

    Instant timestamp;
    int usersCount;
    boolean proxyRunning;
    double load;
    /** Seconds since the proxy process started, 0 when it is not running or the start is unknown. */
    long uptimeSeconds;
    Map<String, Long> counters;

    public long totalUplink() {
        return sum(UPLINK_SUFFIX);
    }

    public long totalDownlink() {
        return sum(DOWNLINK_SUFFIX);
    }

    /**
     * Body sent as the {@code data} of a {@code metrics} webhook event.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", timestamp.toString());
        payload.put("load", load);
        payload.put("users_count", usersCount);
        payload.put("xray_status", proxyRunning ? "running" : "stopped");
        payload.put("uptime", uptimeSeconds);
        payload.put("uplink_bytes", totalUplink());
        payload.put("downlink_bytes", totalDownlink());
        payload.put("counters", counters);
        return payload;
    }

    private long sum(String suffix) {
        long total = 0;
        for (Map.Entry<String, Long> entry : counters.entrySet()) {
            // Only per-user counters, so inbound totals are not counted twice.
            if (entry.getKey().startsWith("user>>>") && entry.getKey().endsWith(suffix)) {
                total += entry.getValue();
            }
        }
        return total;
    }
}
