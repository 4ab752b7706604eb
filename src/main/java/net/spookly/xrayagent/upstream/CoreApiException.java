package net.spookly.xrayagent.upstream;

/**
 * A call to the Core API failed, either on the network or with a non-2xx status.
 */
public class CoreApiException extends Exception {
    private final int statusCode;

    public CoreApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public CoreApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status returned by the Core API, or -1 when no response was received.
     */
    public int statusCode() {
        return statusCode;
    }
}
