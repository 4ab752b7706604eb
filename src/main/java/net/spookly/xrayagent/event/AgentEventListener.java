package net.spookly.xrayagent.event;

import java.util.List;

/**
 * Sink for agent events.
 */
@FunctionalInterface
public interface AgentEventListener {
    AgentEventListener NOOP = event -> {
    };

    void onEvent(AgentEvent event);

    /**
     * Deliver each event to every listener in order. A failing listener does not stop the others.
     */
    static AgentEventListener fanOut(List<AgentEventListener> listeners) {
        List<AgentEventListener> copy = List.copyOf(listeners);
        return event -> {
            for (AgentEventListener listener : copy) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    AgentAuditLogger.INSTANCE.onListenerFailure(event, e);
                }
            }
        };
    }
}
