package net.spookly.xrayagent.event;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Audit listener that emits one log line per event.
 */
public final class AgentAuditLogger implements AgentEventListener {
    public static final AgentAuditLogger INSTANCE = new AgentAuditLogger();

    private static final Logger log = LoggerFactory.getLogger(AgentAuditLogger.class);

    private AgentAuditLogger() {
    }

    @Override
    public void onEvent(AgentEvent event) {
        StringBuilder builder = new StringBuilder("agent_event");
        append(builder, "type", event.type().wireName());
        for (Map.Entry<String, Object> entry : event.data().entrySet()) {
            append(builder, entry.getKey(), entry.getValue());
        }
        append(builder, "timestamp", event.timestamp());
        switch (event.type()) {
            case XRAY_STOPPED, XRAY_DEGRADED, REGISTRATION_FAILED, COMMAND_FAILED -> log.warn("{}", builder);
            default -> log.info("{}", builder);
        }
    }

    void onListenerFailure(AgentEvent event, RuntimeException error) {
        log.error("Failed to deliver agent event {}", event.type().wireName(), error);
    }

    private void append(StringBuilder builder, String key, Object value) {
        if (value == null) {
            return;
        }
        builder.append(' ').append(key).append('=').append(value);
    }
}
