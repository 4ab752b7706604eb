package net.spookly.xrayagent.reconcile;

import java.util.concurrent.TimeoutException;

/**
 * The candidate passed validation but the reload did not complete. The proxy may be running the
 * candidate, its previous document, or anything in between.
 */
public class ReloadIncompleteException extends Exception {
    public ReloadIncompleteException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean timedOut() {
        return getCause() instanceof TimeoutException;
    }
}
