package net.spookly.xrayagent.model;

public enum HealthStatus {
    UNKNOWN,
    UP,
    DOWN,
    DEGRADED;

    public String wireName() {
        return name().toLowerCase();
    }
}
