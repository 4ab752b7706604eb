package net.spookly.xrayagent.endpoint;

import java.util.Map;

/**
 * Read-only agent state exposed by {@code GET /status} and {@code GET /metrics}.
 */
public interface StatusSource {
    Map<String, Object> status();

    /**
     * Prometheus text exposition of the current gauges and counters.
     */
    String prometheus();
}
