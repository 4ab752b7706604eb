package net.spookly.xrayagent.monitor;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.DoubleSupplier;

import net.spookly.xrayagent.model.MetricsSample;
import net.spookly.xrayagent.store.ConfigStore;
import net.spookly.xrayagent.store.ProxyConfiguration;
import net.spookly.xrayagent.upstream.CoreApi;
import net.spookly.xrayagent.xray.ProxyCommandException;
import net.spookly.xrayagent.xray.ProxyController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects usage counters on a fixed interval and pushes them to the Core API.
 * <p>
 * Pushes are fire-and-forget: a failed push is logged and the sample dropped, and a slow push never
 * delays the next collection.
 */
public final class MetricsReporter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MetricsReporter.class);

    private final ProxyController proxy;
    private final ConfigStore store;
    private final CoreApi api;
    private final Duration interval;
    private final DoubleSupplier loadSource;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile MetricsSample lastSample;
    private volatile Instant lastPushAt;
    private ScheduledFuture<?> scheduledTask;

    public MetricsReporter(ProxyController proxy, ConfigStore store, CoreApi api, Duration interval) {
        this(proxy, store, api, interval, MetricsReporter::systemLoad);
    }

    public MetricsReporter(ProxyController proxy,
                           ConfigStore store,
                           CoreApi api,
                           Duration interval,
                           DoubleSupplier loadSource) {
        this.proxy = Objects.requireNonNull(proxy, "proxy");
        this.store = Objects.requireNonNull(store, "store");
        this.api = Objects.requireNonNull(api, "api");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.loadSource = Objects.requireNonNull(loadSource, "loadSource");
        this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory());
    }

    /**
     * Start periodic collection. The first push happens after one interval.
     */
    public synchronized void start() {
        if (stopped.get() || scheduledTask != null) {
            return;
        }
        long millis = interval.toMillis();
        scheduledTask = scheduler.scheduleAtFixedRate(this::tick, millis, millis, TimeUnit.MILLISECONDS);
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

    /**
     * Most recent sample, or null before the first collection.
     */
    public MetricsSample lastSample() {
        return lastSample;
    }

    /**
     * When the Core API last accepted a metrics push, or null.
     */
    public Instant lastPushAt() {
        return lastPushAt;
    }

    public double currentLoad() {
        return loadSource.getAsDouble();
    }

    /**
     * Collect one sample and start pushing it. Returns the sample without waiting for the push.
     */
    MetricsSample runOnce() {
        MetricsSample sample = collect();
        lastSample = sample;
        api.sendMetrics(sample).whenComplete((ignored, error) -> {
            if (error == null) {
                lastPushAt = Instant.now();
                return;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            log.warn("Dropped metrics sample: {}", cause.getMessage());
        });
        return sample;
    }

    MetricsSample collect() {
        Instant now = Instant.now();
        boolean running = proxy.isAlive();
        Map<String, Long> counters = Map.of();
        long uptime = 0;
        if (running) {
            uptime = proxy.startedAt()
                    .map(started -> Math.max(0, Duration.between(started, now).getSeconds()))
                    .orElse(0L);
            try {
                counters = proxy.queryStats().counters();
            } catch (ProxyCommandException e) {
                log.debug("Stats query failed: {}", e.getMessage());
            }
        }
        ProxyConfiguration snapshot = store.snapshot();
        int users = snapshot == null ? 0 : snapshot.userCount();
        return new MetricsSample(now, users, running, loadSource.getAsDouble(), uptime, counters);
    }

    private void tick() {
        if (stopped.get()) {
            return;
        }
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.error("Metrics collection failed unexpectedly", e);
        }
    }

    static double systemLoad() {
        double load = ManagementFactory.getOperatingSystemMXBean().getSystemLoadAverage();
        return load < 0 ? 0.0 : load;
    }

    private static ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "xray-agent-metrics");
            thread.setDaemon(true);
            return thread;
        };
    }
}
