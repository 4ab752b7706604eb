package net.spookly.xrayagent.upstream;

import java.util.Objects;
import java.util.concurrent.CompletionException;

import net.spookly.xrayagent.event.AgentEvent;
import net.spookly.xrayagent.event.AgentEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards agent events to the Core API webhook. Pushes are not retried; a failed push is logged
 * and dropped.
 */
public final class CoreApiEventPublisher implements AgentEventListener {
    private static final Logger log = LoggerFactory.getLogger(CoreApiEventPublisher.class);

    private final CoreApi api;

    public CoreApiEventPublisher(CoreApi api) {
        this.api = Objects.requireNonNull(api, "api");
    }

    @Override
    public void onEvent(AgentEvent event) {
        api.sendEvent(event).whenComplete((ignored, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                log.warn("Dropped {} event: {}", event.type().wireName(), cause.getMessage());
            }
        });
    }
}
