package net.spookly.xrayagent.reconcile;

/**
 * The proxy rejected a candidate document. The candidate was discarded and nothing was reloaded.
 */
public class ValidationException extends Exception {
    private final String proxyOutput;

    public ValidationException(String message, String proxyOutput) {
        super(message);
        this.proxyOutput = proxyOutput;
    }

    public String proxyOutput() {
        return proxyOutput;
    }
}
