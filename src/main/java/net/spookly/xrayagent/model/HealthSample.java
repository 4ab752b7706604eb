package net.spookly.xrayagent.model;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Result of one proxy probe.
 */
@Value
@Accessors(fluent = true)
public class HealthSample {
    HealthStatus status;
    Instant timestamp;
    String detail;
}
