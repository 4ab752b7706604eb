package net.spookly.xrayagent.reconcile;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import net.spookly.xrayagent.event.AgentEvent;
import net.spookly.xrayagent.event.AgentEventListener;
import net.spookly.xrayagent.event.AgentEventType;
import net.spookly.xrayagent.model.Command;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies accepted commands one at a time in arrival order.
 * <p>
 * Submission returns immediately with a ticket; a single worker thread feeds the {@link Reconciler}.
 * The most recent tickets stay queryable by id after they finish.
 */
public final class CommandQueue implements AutoCloseable {
    static final int RETAINED_TICKETS = 256;

    private static final Logger log = LoggerFactory.getLogger(CommandQueue.class);

    private final Reconciler reconciler;
    private final AgentEventListener events;
    private final ThreadPoolExecutor worker;
    private final Map<String, CommandTicket> tickets = new LinkedHashMap<>();
    private final AtomicLong applied = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public CommandQueue(Reconciler reconciler, AgentEventListener events, int capacity) {
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
        this.events = events == null ? AgentEventListener.NOOP : events;
        this.worker = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(capacity),
                runnable -> {
                    Thread thread = new Thread(runnable, "xray-agent-reconciler");
                    thread.setDaemon(true);
                    return thread;
                });
    }

    /**
     * Queue a command behind every command accepted before it.
     *
     * @throws QueueFullException when the queue is at capacity or shutting down
     */
    public CommandTicket submit(Command command) throws QueueFullException {
        CommandTicket ticket = new CommandTicket(UUID.randomUUID().toString(), command);
        synchronized (tickets) {
            try {
                worker.execute(new Job(ticket));
            } catch (RejectedExecutionException e) {
                throw new QueueFullException(worker.isShutdown() ? "agent is shutting down" : "command queue is full");
            }
            tickets.put(ticket.id(), ticket);
            trimTickets();
        }
        log.debug("Queued {} for {} as {}", command.kind().wireName(), command.userUuid(), ticket.id());
        return ticket;
    }

    public Optional<CommandTicket> find(String id) {
        synchronized (tickets) {
            return Optional.ofNullable(tickets.get(id));
        }
    }

    int retainedTickets() {
        synchronized (tickets) {
            return tickets.size();
        }
    }

    public int pending() {
        return worker.getQueue().size();
    }

    public long appliedCount() {
        return applied.get();
    }

    public long failedCount() {
        return failed.get();
    }

    /**
     * Stop accepting commands, drop the ones still waiting and give the in-flight command up to
     * {@code grace} to finish.
     */
    public void shutdown(Duration grace) {
        List<Runnable> waiting = new ArrayList<>();
        synchronized (tickets) {
            worker.shutdown();
            worker.getQueue().drainTo(waiting);
        }
        for (Runnable runnable : waiting) {
            if (runnable instanceof Job job) {
                job.ticket.dropped("agent shut down before the command was applied");
            }
        }
        if (!waiting.isEmpty()) {
            log.warn("Dropped {} queued commands on shutdown", waiting.size());
        }
        try {
            if (!worker.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("In-flight command did not finish within {}ms", grace.toMillis());
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
    }

    @Override
    public void close() {
        shutdown(Duration.ofSeconds(5));
    }

    // Oldest finished tickets go first; queued and in-flight ones are always kept.
    private void trimTickets() {
        Iterator<CommandTicket> iterator = tickets.values().iterator();
        while (tickets.size() > RETAINED_TICKETS && iterator.hasNext()) {
            if (iterator.next().isDone()) {
                iterator.remove();
            }
        }
    }

    private void run(CommandTicket ticket) {
        Command command = ticket.command();
        try {
            ApplyResult result = reconciler.apply(command);
            applied.incrementAndGet();
            if (result.changed()) {
                events.onEvent(AgentEvent.of(successType(command), successData(ticket, result)));
            }
            ticket.applied(result);
        } catch (ReconcileException e) {
            log.warn("Command {} ({} for {}) failed: {} {}", ticket.id(), command.kind().wireName(),
                    command.userUuid(), e.failure().wireName(), e.getMessage());
            fail(ticket, e);
        } catch (RuntimeException e) {
            log.error("Command {} failed unexpectedly", ticket.id(), e);
            fail(ticket, new ReconcileException(ReconcileFailure.PROXY_UNAVAILABLE,
                    "unexpected error: " + e.getMessage(), e));
        }
    }

    // Events go out before the ticket completes, so a caller that sees the outcome also sees the event.
    private void fail(CommandTicket ticket, ReconcileException error) {
        failed.incrementAndGet();
        events.onEvent(AgentEvent.of(AgentEventType.COMMAND_FAILED, failureData(ticket, error)));
        ticket.failed(error);
    }

    private static AgentEventType successType(Command command) {
        switch (command.kind()) {
            case ADD_USER:
                return AgentEventType.USER_ADDED;
            case REMOVE_USER:
                return AgentEventType.USER_REMOVED;
            default:
                return AgentEventType.USER_REGENERATED;
        }
    }

    private static Map<String, Object> successData(CommandTicket ticket, ApplyResult result) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("command_id", ticket.id());
        data.put("user_uuid", ticket.command().userUuid());
        if (ticket.command().oldUserUuid() != null) {
            data.put("old_user_uuid", ticket.command().oldUserUuid());
        }
        data.put("users_count", result.usersCount());
        return data;
    }

    private static Map<String, Object> failureData(CommandTicket ticket, ReconcileException error) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("command_id", ticket.id());
        data.put("command", ticket.command().kind().wireName());
        data.put("user_uuid", ticket.command().userUuid());
        data.put("error", error.failure().wireName());
        data.put("message", error.getMessage());
        return data;
    }

    private final class Job implements Runnable {
        private final CommandTicket ticket;

        private Job(CommandTicket ticket) {
            this.ticket = ticket;
        }

        @Override
        public void run() {
            CommandQueue.this.run(ticket);
        }
    }
}
