package net.spookly.xrayagent.upstream;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Remembers when the Core API last acknowledged a call from this agent.
 */
public final class UpstreamAckTracker {
    private final Clock clock;
    private final Instant createdAt;
    private volatile Instant lastAck;

    public UpstreamAckTracker() {
        this(Clock.systemUTC());
    }

    public UpstreamAckTracker(Clock clock) {
        this.clock = clock;
        this.createdAt = clock.instant();
    }

    public void recordAck() {
        lastAck = clock.instant();
    }

    public Optional<Instant> lastAck() {
        return Optional.ofNullable(lastAck);
    }

    /**
     * Time since the last acknowledgement, or since creation when none was ever received.
     */
    public Duration silence() {
        Instant since = lastAck != null ? lastAck : createdAt;
        Duration silence = Duration.between(since, clock.instant());
        return silence.isNegative() ? Duration.ZERO : silence;
    }
}
