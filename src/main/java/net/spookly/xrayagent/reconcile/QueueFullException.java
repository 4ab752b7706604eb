package net.spookly.xrayagent.reconcile;

/**
 * The command queue is at capacity or no longer accepting work.
 */
public class QueueFullException extends Exception {
    public QueueFullException(String message) {
        super(message);
    }
}
