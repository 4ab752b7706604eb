package net.spookly.xrayagent.model;

import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.experimental.Accessors;
import net.spookly.xrayagent.config.AgentSettings;

/**
 * Identity this agent presents to the Core API. Immutable after startup.
 */
@Value
@Accessors(fluent = true)
public class AgentIdentity {
    public static final String VERSION = "0.1.0";

    long serverId;
    @ToString.Exclude
    @NonNull
    String apiKey;
    @NonNull
    String agentUrl;

    public static AgentIdentity from(AgentSettings settings) {
        return new AgentIdentity(settings.agent.serverId, settings.agent.apiKey, settings.agent.url);
    }
}
