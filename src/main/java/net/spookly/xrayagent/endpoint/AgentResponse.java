package net.spookly.xrayagent.endpoint;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;

/**
 * JSON response envelope for the agent's HTTP API.
 */
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class AgentResponse {
    public final boolean ok;
    public final String message;
    public final Object data;

    public static AgentResponse ok(String message, Object data) {
        return new AgentResponse(true, message, data);
    }

    public static AgentResponse error(String message) {
        return new AgentResponse(false, message, null);
    }
}
