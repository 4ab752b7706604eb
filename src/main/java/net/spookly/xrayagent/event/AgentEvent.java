package net.spookly.xrayagent.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Something the agent reports upstream: a health transition, a command outcome or a registration failure.
 */
@Value
@Accessors(fluent = true)
public class AgentEvent {
    AgentEventType type;
    Instant timestamp;
    Map<String, Object> data;

    public static AgentEvent of(AgentEventType type, Map<String, ?> data) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (data != null) {
            copy.putAll(data);
        }
        return new AgentEvent(type, Instant.now(), Collections.unmodifiableMap(copy));
    }
}
