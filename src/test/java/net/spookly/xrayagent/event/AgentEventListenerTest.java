package net.spookly.xrayagent.event;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class AgentEventListenerTest {
    @Test
    void fanOutContinuesPastFailingListener() {
        List<AgentEvent> received = new ArrayList<>();
        AgentEventListener failing = event -> {
            throw new IllegalStateException("boom");
        };
        AgentEventListener listener = AgentEventListener.fanOut(List.of(failing, received::add));

        AgentEvent event = AgentEvent.of(AgentEventType.XRAY_STOPPED, Map.of("detail", "port closed"));
        listener.onEvent(event);

        assertEquals(List.of(event), received);
    }

    @Test
    void auditLoggerAcceptsEveryEventType() {
        for (AgentEventType type : AgentEventType.values()) {
            AgentAuditLogger.INSTANCE.onEvent(AgentEvent.of(type, Map.of("user_uuid", "u")));
        }
    }

    @Test
    void eventDataIsCopied() {
        Map<String, Object> data = new HashMap<>();
        data.put("k", "v");
        AgentEvent event = AgentEvent.of(AgentEventType.USER_ADDED, data);
        data.put("k", "changed");

        assertEquals("v", event.data().get("k"));
        assertEquals("user_added", event.type().wireName());
    }
}
