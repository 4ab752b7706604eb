package net.spookly.xrayagent.endpoint;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import net.spookly.xrayagent.model.Command;
import net.spookly.xrayagent.model.CommandKind;

/**
 * Body of {@code POST /commands}. Fields the agent does not use, such as {@code server_id}, are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CommandRequest {
    public String command;
    @JsonProperty("user_uuid")
    public String userUuid;
    @JsonProperty("old_user_uuid")
    public String oldUserUuid;
    public String email;

    /**
     * Convert to a command, rejecting unknown kinds and malformed uuids.
     *
     * @throws BadCommandException when the request does not describe a valid command
     */
    public Command toCommand() {
        if (command == null || command.isBlank()) {
            throw new BadCommandException("command is required");
        }
        CommandKind kind = CommandKind.fromWire(command)
                .orElseThrow(() -> new BadCommandException("unknown command: " + command));
        String uuid = requireUuid(userUuid, "user_uuid");
        String cleanEmail = email == null || email.isBlank() ? null : email.trim();
        switch (kind) {
            case ADD_USER:
                return Command.addUser(uuid, cleanEmail);
            case REMOVE_USER:
                return Command.removeUser(uuid);
            case REGENERATE_USER:
                String oldUuid = requireUuid(oldUserUuid, "old_user_uuid");
                if (oldUuid.equals(uuid)) {
                    throw new BadCommandException("old_user_uuid must differ from user_uuid");
                }
                return Command.regenerateUser(oldUuid, uuid, cleanEmail);
            default:
                throw new BadCommandException("unknown command: " + command);
        }
    }

    static String requireUuid(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new BadCommandException(field + " is required");
        }
        String trimmed = value.trim();
        try {
            UUID parsed = UUID.fromString(trimmed);
            // UUID.fromString accepts short groups like 1-1-1-1-1.
            if (!parsed.toString().equalsIgnoreCase(trimmed)) {
                throw new BadCommandException(field + " must be a UUID");
            }
        } catch (IllegalArgumentException e) {
            throw new BadCommandException(field + " must be a UUID");
        }
        return trimmed.toLowerCase();
    }
}
