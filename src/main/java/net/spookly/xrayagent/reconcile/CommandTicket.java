package net.spookly.xrayagent.reconcile;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import net.spookly.xrayagent.model.Command;

/**
 * Tracks one accepted command from the moment it is queued until it is applied, fails or is dropped.
 */
public final class CommandTicket {
    public enum State {
        QUEUED("queued"),
        APPLIED("applied"),
        FAILED("failed"),
        DROPPED("dropped");

        private final String wireName;

        State(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    private final String id;
    private final Command command;
    private final Instant acceptedAt;
    private final CompletableFuture<ApplyResult> completion = new CompletableFuture<>();
    private volatile State state = State.QUEUED;
    private volatile ReconcileFailure failure;
    private volatile String message;
    private volatile Instant finishedAt;

    CommandTicket(String id, Command command) {
        this.id = Objects.requireNonNull(id, "id");
        this.command = Objects.requireNonNull(command, "command");
        this.acceptedAt = Instant.now();
    }

    public String id() {
        return id;
    }

    public Command command() {
        return command;
    }

    public State state() {
        return state;
    }

    public ReconcileFailure failure() {
        return failure;
    }

    public String message() {
        return message;
    }

    public boolean isDone() {
        return state != State.QUEUED;
    }

    /**
     * Completes with the apply result, or exceptionally with the {@link ReconcileException}.
     */
    public CompletableFuture<ApplyResult> completion() {
        return completion;
    }

    /**
     * Status document returned by {@code GET /commands/{id}}.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("command_id", id);
        payload.put("command", command.kind().wireName());
        payload.put("user_uuid", command.userUuid());
        if (command.oldUserUuid() != null) {
            payload.put("old_user_uuid", command.oldUserUuid());
        }
        payload.put("status", state.wireName());
        if (failure != null) {
            payload.put("error", failure.wireName());
        }
        if (message != null) {
            payload.put("message", message);
        }
        payload.put("accepted_at", acceptedAt.toString());
        if (finishedAt != null) {
            payload.put("finished_at", finishedAt.toString());
        }
        return payload;
    }

    void applied(ApplyResult result) {
        message = result.changed() ? null : "already in effect";
        finish(State.APPLIED);
        completion.complete(result);
    }

    void failed(ReconcileException error) {
        failure = error.failure();
        message = error.getMessage();
        finish(State.FAILED);
        completion.completeExceptionally(error);
    }

    void dropped(String reason) {
        message = reason;
        finish(State.DROPPED);
        completion.cancel(false);
    }

    private void finish(State terminal) {
        finishedAt = Instant.now();
        state = terminal;
    }
}
