package net.spookly.xrayagent.monitor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import net.spookly.xrayagent.endpoint.StatusSource;
import net.spookly.xrayagent.model.MetricsSample;
import net.spookly.xrayagent.reconcile.CommandQueue;
import net.spookly.xrayagent.store.ConfigStore;
import net.spookly.xrayagent.store.ProxyConfiguration;
import net.spookly.xrayagent.upstream.RegistrationManager;
import net.spookly.xrayagent.upstream.UpstreamAckTracker;

/**
 * Read-only status assembled from the monitors, the registration state and the committed config.
 */
public final class AgentStatusView implements StatusSource {
    private final HealthMonitor healthMonitor;
    private final MetricsReporter metricsReporter;
    private final RegistrationManager registrationManager;
    private final UpstreamAckTracker ackTracker;
    private final ConfigStore store;
    private final CommandQueue queue;

    public AgentStatusView(HealthMonitor healthMonitor,
                           MetricsReporter metricsReporter,
                           RegistrationManager registrationManager,
                           UpstreamAckTracker ackTracker,
                           ConfigStore store,
                           CommandQueue queue) {
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor");
        this.metricsReporter = Objects.requireNonNull(metricsReporter, "metricsReporter");
        this.registrationManager = Objects.requireNonNull(registrationManager, "registrationManager");
        this.ackTracker = Objects.requireNonNull(ackTracker, "ackTracker");
        this.store = Objects.requireNonNull(store, "store");
        this.queue = Objects.requireNonNull(queue, "queue");
    }

    @Override
    public Map<String, Object> status() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("xray_status", healthMonitor.status().wireName());
        data.put("xray_running", healthMonitor.proxyRunning());
        data.put("users_count", usersCount());
        data.put("registered", registrationManager.isRegistered());
        MetricsSample sample = metricsReporter.lastSample();
        data.put("last_metrics_at", sample == null ? null : sample.timestamp().toString());
        Instant pushed = metricsReporter.lastPushAt();
        data.put("last_metrics_push_at", pushed == null ? null : pushed.toString());
        data.put("last_core_ack_at", ackTracker.lastAck().map(Instant::toString).orElse(null));
        data.put("commands_applied", queue.appliedCount());
        data.put("commands_failed", queue.failedCount());
        return data;
    }

    @Override
    public String prometheus() {
        return PrometheusFormatter.format(
                usersCount(),
                healthMonitor.proxyRunning(),
                metricsReporter.currentLoad(),
                queue.appliedCount(),
                queue.failedCount());
    }

    private int usersCount() {
        ProxyConfiguration snapshot = store.snapshot();
        return snapshot == null ? 0 : snapshot.userCount();
    }
}
