package net.spookly.xrayagent.upstream;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import net.spookly.xrayagent.event.AgentEvent;
import net.spookly.xrayagent.event.AgentEventListener;
import net.spookly.xrayagent.event.AgentEventType;
import net.spookly.xrayagent.util.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers the agent with the Core API in the background and keeps it registered.
 * <p>
 * Failed attempts are retried on the backoff schedule without limit. Once registered, a watchdog
 * re-registers when the Core API has not acknowledged any call for longer than the configured
 * silence.
 */
public final class RegistrationManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RegistrationManager.class);
    private static final Duration MAX_WATCHDOG_INTERVAL = Duration.ofSeconds(30);

    private final CoreApi api;
    private final UpstreamAckTracker ackTracker;
    private final Backoff backoff;
    private final Duration reregisterAfter;
    private final AgentEventListener events;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile boolean registered;
    private volatile int failedAttempts;
    private ScheduledFuture<?> watchdog;

    public RegistrationManager(CoreApi api,
                               UpstreamAckTracker ackTracker,
                               Backoff backoff,
                               Duration reregisterAfter,
                               AgentEventListener events) {
        this.api = Objects.requireNonNull(api, "api");
        this.ackTracker = Objects.requireNonNull(ackTracker, "ackTracker");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.reregisterAfter = Objects.requireNonNull(reregisterAfter, "reregisterAfter");
        this.events = events == null ? AgentEventListener.NOOP : events;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory());
    }

    /**
     * Begin registering. Returns immediately.
     */
    public synchronized void start() {
        if (stopped.get() || watchdog != null) {
            return;
        }
        scheduler.execute(this::attemptAndReschedule);
        long intervalMillis = Math.max(1, Math.min(reregisterAfter.toMillis() / 3, MAX_WATCHDOG_INTERVAL.toMillis()));
        watchdog = scheduler.scheduleWithFixedDelay(this::checkAcknowledgements,
                intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        synchronized (this) {
            if (watchdog != null) {
                watchdog.cancel(false);
                watchdog = null;
            }
        }
        scheduler.shutdownNow();
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRegistered() {
        return registered;
    }

    /**
     * Consecutive failed attempts since the last successful registration.
     */
    public int failedAttempts() {
        return failedAttempts;
    }

    /**
     * One registration attempt. Returns true when the Core API accepted it.
     */
    boolean attemptOnce() {
        try {
            api.register();
        } catch (CoreApiException e) {
            int attempt = ++failedAttempts;
            log.warn("Registration attempt {} failed: {}", attempt, e.getMessage());
            if (attempt == 1) {
                events.onEvent(AgentEvent.of(AgentEventType.REGISTRATION_FAILED,
                        Map.of("attempt", attempt, "error", e.getMessage())));
            }
            return false;
        }
        boolean recovered = failedAttempts > 0;
        failedAttempts = 0;
        registered = true;
        log.info("Registered with Core API{}", recovered ? " after retrying" : "");
        events.onEvent(AgentEvent.of(AgentEventType.AGENT_REGISTERED, Map.of()));
        return true;
    }

    /**
     * Start re-registration when the Core API has been silent for too long. Returns true when it did.
     */
    boolean checkAcknowledgements() {
        if (stopped.get() || !registered) {
            return false;
        }
        Duration silence = ackTracker.silence();
        if (silence.compareTo(reregisterAfter) <= 0) {
            return false;
        }
        log.warn("Core API has not acknowledged the agent for {}s, registering again", silence.toSeconds());
        registered = false;
        scheduler.execute(this::attemptAndReschedule);
        return true;
    }

    /**
     * Delay before the next attempt after the given number of consecutive failures.
     */
    Duration retryDelay(int failures) {
        return backoff.delayFor(Math.max(0, failures - 1));
    }

    private void attemptAndReschedule() {
        if (stopped.get() || registered) {
            return;
        }
        if (attemptOnce()) {
            return;
        }
        Duration delay = retryDelay(failedAttempts);
        log.debug("Retrying registration in {}ms", delay.toMillis());
        try {
            scheduler.schedule(this::attemptAndReschedule, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Registration retry not scheduled, manager stopped");
        }
    }

    private static ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "xray-agent-registration");
            thread.setDaemon(true);
            return thread;
        };
    }
}
