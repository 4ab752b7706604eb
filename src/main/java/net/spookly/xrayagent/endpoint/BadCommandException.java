package net.spookly.xrayagent.endpoint;

/**
 * A command request that cannot be turned into a command. Reported to the caller as 400.
 */
public class BadCommandException extends IllegalArgumentException {
    public BadCommandException(String message) {
        super(message);
    }
}
