package net.spookly.xrayagent.reconcile;

import java.util.Objects;

public class ReconcileException extends Exception {
    private final ReconcileFailure failure;

    public ReconcileException(ReconcileFailure failure, String message) {
        this(failure, message, null);
    }

    public ReconcileException(ReconcileFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = Objects.requireNonNull(failure, "failure");
    }

    public ReconcileFailure failure() {
        return failure;
    }
}
