package net.spookly.xrayagent.model;

import java.util.Optional;

/**
 * Commands the Core API may push to the agent.
 */
public enum CommandKind {
    ADD_USER("add_user"),
    REMOVE_USER("remove_user"),
    REGENERATE_USER("regenerate_user");

    private final String wireName;

    CommandKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<CommandKind> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (CommandKind kind : values()) {
            if (kind.wireName.equals(value.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
