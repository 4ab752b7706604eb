package net.spookly.xrayagent.upstream;

import java.util.concurrent.CompletableFuture;

import net.spookly.xrayagent.event.AgentEvent;
import net.spookly.xrayagent.model.MetricsSample;

/**
 * Outbound calls to the Core API. Every call carries the agent's shared secret.
 */
public interface CoreApi {
    /**
     * Announce this agent and its reachable URL.
     */
    void register() throws CoreApiException;

    /**
     * Push an event. The future fails with {@link CoreApiException} when the push was not acknowledged.
     */
    CompletableFuture<Void> sendEvent(AgentEvent event);

    CompletableFuture<Void> sendMetrics(MetricsSample sample);
}
