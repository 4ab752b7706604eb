package net.spookly.xrayagent.reconcile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import net.spookly.xrayagent.event.AgentEvent;
import net.spookly.xrayagent.event.AgentEventType;
import net.spookly.xrayagent.model.Command;
import net.spookly.xrayagent.store.ConfigStore;
import net.spookly.xrayagent.xray.FakeProxyController;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CommandQueueTest {
    private static final String USER_A = "11111111-1111-1111-1111-111111111111";
    private static final String USER_B = "22222222-2222-2222-2222-222222222222";

    @TempDir
    Path tempDir;

    private FakeProxyController proxy;
    private ConfigStore store;
    private final List<AgentEvent> events = new CopyOnWriteArrayList<>();
    private CommandQueue queue;

    @BeforeEach
    void setUp() throws Exception {
        proxy = new FakeProxyController();
        store = new ConfigStore(tempDir.resolve("config.json"), "vless");
        store.open();
    }

    @AfterEach
    void tearDown() {
        if (queue != null) {
            queue.shutdown(Duration.ofSeconds(5));
        }
    }

    @Test
    void appliesCommandsInSubmissionOrder() throws Exception {
        queue = queue(100);
        List<CommandTicket> tickets = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            tickets.add(queue.submit(Command.addUser(USER_A, null)));
            tickets.add(queue.submit(Command.removeUser(USER_A)));
        }
        tickets.add(queue.submit(Command.addUser(USER_B, null)));

        for (CommandTicket ticket : tickets) {
            ticket.completion().get(5, TimeUnit.SECONDS);
        }

        assertFalse(store.read().containsUser(USER_A));
        assertTrue(store.read().containsUser(USER_B));
        List<AgentEventType> types = new ArrayList<>();
        for (AgentEvent event : events) {
            types.add(event.type());
        }
        assertEquals(21, types.size());
        for (int i = 0; i < 20; i++) {
            assertEquals(i % 2 == 0 ? AgentEventType.USER_ADDED : AgentEventType.USER_REMOVED, types.get(i));
        }
        assertEquals(21, queue.appliedCount());
    }

    @Test
    void failedCommandIsRecordedOnTicketAndReported() throws Exception {
        queue = queue(100);
        proxy.validator = content -> false;

        CommandTicket ticket = queue.submit(Command.addUser(USER_A, null));

        ExecutionException exception = assertThrows(ExecutionException.class,
                () -> ticket.completion().get(5, TimeUnit.SECONDS));
        assertTrue(exception.getCause() instanceof ReconcileException);
        assertEquals(CommandTicket.State.FAILED, ticket.state());
        assertEquals(ReconcileFailure.INVALID_CONFIG, ticket.failure());
        assertEquals("invalid_config", ticket.toPayload().get("error"));
        assertEquals(1, queue.failedCount());
        assertEquals(AgentEventType.COMMAND_FAILED, events.get(0).type());
        assertEquals(ticket.id(), events.get(0).data().get("command_id"));
        assertEquals(ticket, queue.find(ticket.id()).orElseThrow());
    }

    @Test
    void noOpCommandsAreAppliedWithoutEvent() throws Exception {
        queue = queue(100);

        CommandTicket ticket = queue.submit(Command.removeUser(USER_A));
        ApplyResult result = ticket.completion().get(5, TimeUnit.SECONDS);

        assertFalse(result.changed());
        assertEquals(CommandTicket.State.APPLIED, ticket.state());
        assertEquals("already in effect", ticket.message());
        assertTrue(events.isEmpty());
    }

    @Test
    void rejectsSubmissionsWhenFull() throws Exception {
        queue = queue(1);
        CountDownLatch gate = new CountDownLatch(1);
        proxy.validateGate = gate;
        try {
            CommandTicket inFlight = queue.submit(Command.addUser(USER_A, null));
            CommandTicket waiting = queue.submit(Command.addUser(USER_B, null));

            assertThrows(QueueFullException.class, () -> queue.submit(Command.removeUser(USER_A)));
            assertEquals(CommandTicket.State.QUEUED, waiting.state());
            assertFalse(inFlight.isDone());
        } finally {
            gate.countDown();
        }
    }

    @Test
    void finishedTicketsShrinkBackAfterBurst() throws Exception {
        queue = queue(400);
        CountDownLatch gate = new CountDownLatch(1);
        proxy.validateGate = gate;
        List<CommandTicket> burst = new ArrayList<>();
        try {
            for (int i = 0; i < 300; i++) {
                burst.add(queue.submit(i % 2 == 0 ? Command.addUser(USER_A, null) : Command.removeUser(USER_A)));
            }
            assertEquals(300, queue.retainedTickets());
        } finally {
            gate.countDown();
        }
        for (CommandTicket ticket : burst) {
            ticket.completion().get(10, TimeUnit.SECONDS);
        }

        CommandTicket next = queue.submit(Command.addUser(USER_B, null));
        next.completion().get(5, TimeUnit.SECONDS);

        assertEquals(CommandQueue.RETAINED_TICKETS, queue.retainedTickets());
        assertTrue(queue.find(burst.get(0).id()).isEmpty());
        assertTrue(queue.find(burst.get(299).id()).isPresent());
        assertTrue(queue.find(next.id()).isPresent());
    }

    @Test
    void shutdownDropsWaitingCommandsAndFinishesInFlight() throws Exception {
        queue = queue(10);
        CountDownLatch gate = new CountDownLatch(1);
        proxy.validateGate = gate;
        CommandTicket inFlight = queue.submit(Command.addUser(USER_A, null));
        CommandTicket waiting = queue.submit(Command.addUser(USER_B, null));
        Thread releaser = new Thread(() -> {
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            gate.countDown();
        });
        releaser.start();

        queue.shutdown(Duration.ofSeconds(5));
        releaser.join();

        assertEquals(CommandTicket.State.APPLIED, inFlight.state());
        assertEquals(CommandTicket.State.DROPPED, waiting.state());
        assertTrue(store.read().containsUser(USER_A));
        assertFalse(store.read().containsUser(USER_B));
        assertThrows(QueueFullException.class, () -> queue.submit(Command.removeUser(USER_A)));
    }

    private CommandQueue queue(int capacity) {
        ReloadExecutor executor = new ReloadExecutor(proxy, tempDir.resolve(".scratch"), Duration.ofSeconds(5));
        Reconciler reconciler = new Reconciler(store, executor, "", 3, Duration.ZERO);
        return new CommandQueue(reconciler, events::add, capacity);
    }
}
