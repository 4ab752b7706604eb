package net.spookly.xrayagent.monitor;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import net.spookly.xrayagent.event.AgentEvent;
import net.spookly.xrayagent.event.AgentEventListener;
import net.spookly.xrayagent.event.AgentEventType;
import net.spookly.xrayagent.model.HealthSample;
import net.spookly.xrayagent.model.HealthStatus;
import net.spookly.xrayagent.xray.ProxyCommandException;
import net.spookly.xrayagent.xray.ProxyController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically probes the proxy and tracks its health state.
 * <p>
 * A probe is {@code up} when the management port accepts connections and answers a stats query,
 * {@code degraded} when the port is open but the query fails, and {@code down} when the port is
 * closed. Leaving {@code up} needs {@code failureThreshold} consecutive bad probes. Every other
 * change, including {@code down} to {@code degraded} and back, follows the first probe that shows
 * it. One event is raised per state change, never per tick. The monitor only
 * reads proxy-external state and never touches the config store.
 */
public final class HealthMonitor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final ProxyController proxy;
    private final int failureThreshold;
    private final Duration interval;
    private final AgentEventListener events;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile HealthStatus status = HealthStatus.UNKNOWN;
    private volatile HealthSample lastSample;
    private int consecutiveFailures;
    private ScheduledFuture<?> scheduledTask;

    public HealthMonitor(ProxyController proxy, int failureThreshold, Duration interval, AgentEventListener events) {
        this.proxy = Objects.requireNonNull(proxy, "proxy");
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be greater than 0");
        }
        this.failureThreshold = failureThreshold;
        this.interval = Objects.requireNonNull(interval, "interval");
        this.events = events == null ? AgentEventListener.NOOP : events;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory());
    }

    /**
     * Start periodic probes, the first one immediately.
     */
    public synchronized void start() {
        if (stopped.get() || scheduledTask != null) {
            return;
        }
        scheduledTask = scheduler.scheduleAtFixedRate(this::tick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        synchronized (this) {
            if (scheduledTask != null) {
                scheduledTask.cancel(false);
                scheduledTask = null;
            }
        }
        scheduler.shutdownNow();
    }

    @Override
    public void close() {
        stop();
    }

    public HealthStatus status() {
        return status;
    }

    public HealthSample lastSample() {
        return lastSample;
    }

    /**
     * True while the proxy process answers on its management port.
     */
    public boolean proxyRunning() {
        return status == HealthStatus.UP || status == HealthStatus.DEGRADED;
    }

    /**
     * Probe once and apply the result to the state machine. Returns the raw probe result.
     */
    synchronized HealthSample runOnce() {
        HealthSample sample = probe();
        lastSample = sample;
        if (sample.status() == HealthStatus.UP) {
            consecutiveFailures = 0;
            transition(HealthStatus.UP, sample);
            return sample;
        }
        consecutiveFailures++;
        if (consecutiveFailures >= failureThreshold || status != HealthStatus.UP) {
            transition(sample.status(), sample);
        } else {
            log.debug("Proxy probe {} ({}/{}): {}", sample.status().wireName(), consecutiveFailures,
                    failureThreshold, sample.detail());
        }
        return sample;
    }

    private void tick() {
        if (stopped.get()) {
            return;
        }
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.error("Health probe failed unexpectedly", e);
        }
    }

    private HealthSample probe() {
        Instant now = Instant.now();
        if (!proxy.isAlive()) {
            return new HealthSample(HealthStatus.DOWN, now, "management interface not reachable");
        }
        try {
            proxy.queryStats();
            return new HealthSample(HealthStatus.UP, now, null);
        } catch (ProxyCommandException e) {
            return new HealthSample(HealthStatus.DEGRADED, now, e.getMessage());
        }
    }

    private void transition(HealthStatus next, HealthSample sample) {
        HealthStatus previous = status;
        if (previous == next) {
            return;
        }
        status = next;
        AgentEventType type = eventFor(previous, next);
        if (type == null) {
            log.info("Proxy health {} -> {}", previous.wireName(), next.wireName());
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("previous", previous.wireName());
        data.put("status", next.wireName());
        if (sample.detail() != null) {
            data.put("detail", sample.detail());
        }
        events.onEvent(AgentEvent.of(type, data));
    }

    private static AgentEventType eventFor(HealthStatus previous, HealthStatus next) {
        switch (next) {
            case DOWN:
                return AgentEventType.XRAY_STOPPED;
            case DEGRADED:
                return AgentEventType.XRAY_DEGRADED;
            case UP:
                return previous == HealthStatus.UNKNOWN ? null : AgentEventType.XRAY_RECOVERED;
            default:
                return null;
        }
    }

    private static ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "xray-agent-health");
            thread.setDaemon(true);
            return thread;
        };
    }
}
