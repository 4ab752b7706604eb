package net.spookly.xrayagent.endpoint;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.spookly.xrayagent.model.Command;
import net.spookly.xrayagent.model.CommandKind;
import org.junit.jupiter.api.Test;

class CommandRequestTest {
    private static final String USER_A = "11111111-1111-1111-1111-111111111111";
    private static final String USER_B = "22222222-2222-2222-2222-222222222222";

    @Test
    void buildsAddUserWithTrimmedEmail() {
        Command command = request("add_user", USER_A.toUpperCase(), null, "  a@example.com ").toCommand();

        assertEquals(CommandKind.ADD_USER, command.kind());
        assertEquals(USER_A, command.userUuid());
        assertEquals("a@example.com", command.email());
    }

    @Test
    void removeUserIgnoresEmail() {
        Command command = request("remove_user", USER_A, null, "a@example.com").toCommand();

        assertNull(command.email());
    }

    @Test
    void regenerateRequiresDistinctOldUuid() {
        Command command = request("regenerate_user", USER_B, USER_A, null).toCommand();
        assertEquals(USER_A, command.oldUserUuid());
        assertEquals(USER_B, command.userUuid());

        assertThrows(BadCommandException.class, () -> request("regenerate_user", USER_B, null, null).toCommand());
        assertThrows(BadCommandException.class, () -> request("regenerate_user", USER_A, USER_A, null).toCommand());
    }

    @Test
    void rejectsUnknownKindAndMalformedUuid() {
        BadCommandException unknown = assertThrows(BadCommandException.class,
                () -> request("restart_xray", USER_A, null, null).toCommand());
        assertEquals("unknown command: restart_xray", unknown.getMessage());

        BadCommandException malformed = assertThrows(BadCommandException.class,
                () -> request("add_user", "1-1-1-1-1", null, null).toCommand());
        assertEquals("user_uuid must be a UUID", malformed.getMessage());

        assertThrows(BadCommandException.class, () -> request(null, USER_A, null, null).toCommand());
    }

    private static CommandRequest request(String kind, String uuid, String oldUuid, String email) {
        CommandRequest request = new CommandRequest();
        request.command = kind;
        request.userUuid = uuid;
        request.oldUserUuid = oldUuid;
        request.email = email;
        return request;
    }
}
