package net.spookly.xrayagent.xray;

/**
 * An external proxy operation could not be completed.
 */
public class ProxyCommandException extends Exception {
    private final boolean timedOut;

    public ProxyCommandException(String message) {
        this(message, null, false);
    }

    public ProxyCommandException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private ProxyCommandException(String message, Throwable cause, boolean timedOut) {
        super(message, cause);
        this.timedOut = timedOut;
    }

    public static ProxyCommandException timeout(String message) {
        return new ProxyCommandException(message, null, true);
    }

    public boolean timedOut() {
        return timedOut;
    }
}
