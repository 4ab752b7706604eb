package net.spookly.xrayagent.upstream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;

class UpstreamAckTrackerTest {
    @Test
    void silenceCountsFromCreationUntilFirstAck() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        UpstreamAckTracker tracker = new UpstreamAckTracker(clock);

        clock.advance(Duration.ofSeconds(90));
        assertFalse(tracker.lastAck().isPresent());
        assertEquals(Duration.ofSeconds(90), tracker.silence());

        tracker.recordAck();
        clock.advance(Duration.ofSeconds(5));
        assertEquals(Duration.ofSeconds(5), tracker.silence());
        assertEquals(Instant.parse("2026-01-01T00:01:30Z"), tracker.lastAck().orElseThrow());
    }
}
