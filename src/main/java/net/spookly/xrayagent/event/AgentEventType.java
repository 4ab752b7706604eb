package net.spookly.xrayagent.event;

/**
 * Event names reported to the Core API webhook.
 */
public enum AgentEventType {
    AGENT_REGISTERED("agent_registered"),
    REGISTRATION_FAILED("registration_failed"),
    XRAY_STOPPED("xray_stopped"),
    XRAY_DEGRADED("xray_degraded"),
    XRAY_RECOVERED("xray_recovered"),
    USER_ADDED("user_added"),
    USER_REMOVED("user_removed"),
    USER_REGENERATED("user_regenerated"),
    COMMAND_FAILED("command_failed");

    private final String wireName;

    AgentEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
