package net.spookly.xrayagent.xray;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * Operations the agent needs from the local proxy process. Implementations must bound the time
 * each call may take.
 */
public interface ProxyController extends AutoCloseable {
    /**
     * Run the proxy's configuration test against a candidate document.
     */
    ProxyCommandResult validate(Path candidate) throws ProxyCommandException;

    /**
     * Ask the running proxy to load the given, already validated, document in place without
     * dropping connections.
     */
    void reload(Path candidate) throws ProxyCommandException;

    /**
     * True when the proxy's management interface accepts connections.
     */
    boolean isAlive();

    /**
     * Read traffic counters from the management interface.
     */
    ProxyStats queryStats() throws ProxyCommandException;

    /**
     * When the proxy process started, if that can be determined.
     */
    default Optional<Instant> startedAt() {
        return Optional.empty();
    }

    @Override
    default void close() {
    }
}
