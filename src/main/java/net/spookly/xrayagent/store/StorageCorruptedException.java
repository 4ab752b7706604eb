package net.spookly.xrayagent.store;

/**
 * The live proxy document exists but cannot be used. Fatal at startup.
 */
public class StorageCorruptedException extends Exception {
    public StorageCorruptedException(String message) {
        super(message);
    }

    public StorageCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
