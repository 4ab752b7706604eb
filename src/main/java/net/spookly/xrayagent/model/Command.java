package net.spookly.xrayagent.model;

import lombok.NonNull;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * A unit of work delivered by the Core API. Delivery may repeat, so applying a command is keyed by
 * user uuid rather than treated as a delta.
 */
@Value
@Accessors(fluent = true)
public class Command {
    @NonNull
    CommandKind kind;
    @NonNull
    String userUuid;
    /**
     * Only set for {@link CommandKind#REGENERATE_USER}.
     */
    String oldUserUuid;
    String email;

    public static Command addUser(String userUuid, String email) {
        return new Command(CommandKind.ADD_USER, userUuid, null, email);
    }

    public static Command removeUser(String userUuid) {
        return new Command(CommandKind.REMOVE_USER, userUuid, null, null);
    }

    public static Command regenerateUser(String oldUserUuid, String newUserUuid, String email) {
        return new Command(CommandKind.REGENERATE_USER, newUserUuid, oldUserUuid, email);
    }
}
