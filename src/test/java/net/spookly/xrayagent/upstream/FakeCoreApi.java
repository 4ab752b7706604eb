package net.spookly.xrayagent.upstream;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import net.spookly.xrayagent.event.AgentEvent;
import net.spookly.xrayagent.model.MetricsSample;

/**
 * In-memory Core API. Registration fails while {@link #registerFailures} is positive.
 */
public final class FakeCoreApi implements CoreApi {
    public final AtomicInteger registerCalls = new AtomicInteger();
    public final AtomicInteger registerFailures = new AtomicInteger();
    public final List<AgentEvent> events = new CopyOnWriteArrayList<>();
    public final List<MetricsSample> metrics = new CopyOnWriteArrayList<>();
    public volatile boolean pushFails;

    @Override
    public void register() throws CoreApiException {
        registerCalls.incrementAndGet();
        if (registerFailures.getAndUpdate(remaining -> Math.max(0, remaining - 1)) > 0) {
            throw new CoreApiException("registration returned 503", 503);
        }
    }

    @Override
    public CompletableFuture<Void> sendEvent(AgentEvent event) {
        if (pushFails) {
            return CompletableFuture.failedFuture(new CoreApiException("webhook returned 500", 500));
        }
        events.add(event);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> sendMetrics(MetricsSample sample) {
        if (pushFails) {
            return CompletableFuture.failedFuture(new CoreApiException("webhook returned 500", 500));
        }
        metrics.add(sample);
        return CompletableFuture.completedFuture(null);
    }
}
