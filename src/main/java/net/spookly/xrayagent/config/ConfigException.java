package net.spookly.xrayagent.config;

/**
 * Raised when the agent configuration cannot be loaded or fails validation.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
