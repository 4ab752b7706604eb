package net.spookly.xrayagent.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.spookly.xrayagent.model.ProxyUser;
import org.junit.jupiter.api.Test;

class ProxyConfigurationTest {
    private static final String USER_A = "11111111-1111-1111-1111-111111111111";
    private static final String USER_B = "22222222-2222-2222-2222-222222222222";
    private static final String DOCUMENT = String.join("\n",
            "{",
            "  \"log\": {\"loglevel\": \"warning\"},",
            "  \"api\": {\"tag\": \"api\", \"services\": [\"StatsService\"]},",
            "  \"inbounds\": [",
            "    {\"tag\": \"api\", \"protocol\": \"dokodemo-door\", \"port\": 10085},",
            "    {\"tag\": \"vless\", \"protocol\": \"vless\", \"port\": 443,",
            "     \"settings\": {\"clients\": [], \"decryption\": \"none\"},",
            "     \"streamSettings\": {\"security\": \"reality\"}}",
            "  ]",
            "}");

    @Test
    void addsClientWithDefaultEmailAndFlow() throws IOException {
        ProxyConfiguration configuration = parse(DOCUMENT);

        ProxyConfiguration updated = configuration.withUserAdded(new ProxyUser(USER_A, null), "xtls-rprx-vision");

        assertEquals(0, configuration.userCount());
        assertEquals(List.of(new ProxyUser(USER_A, "user-11111111")), updated.users());
        JsonNode client = tree(updated).path("inbounds").get(1).path("settings").path("clients").get(0);
        assertEquals("xtls-rprx-vision", client.path("flow").asText());
    }

    @Test
    void addingPresentUserReturnsSameDocument() throws IOException {
        ProxyConfiguration configuration = parse(DOCUMENT).withUserAdded(new ProxyUser(USER_A, "a@example.com"), "");

        assertSame(configuration, configuration.withUserAdded(new ProxyUser(USER_A, "other@example.com"), ""));
    }

    @Test
    void replacesClientHoldingTheSameEmail() throws IOException {
        ProxyConfiguration configuration = parse(DOCUMENT)
                .withUserAdded(new ProxyUser(USER_A, "shared@example.com"), "");

        ProxyConfiguration updated = configuration.withUserAdded(new ProxyUser(USER_B, "shared@example.com"), "");

        assertEquals(List.of(new ProxyUser(USER_B, "shared@example.com")), updated.users());
    }

    @Test
    void removesOnlyTheMatchingClient() throws IOException {
        ProxyConfiguration configuration = parse(DOCUMENT)
                .withUserAdded(new ProxyUser(USER_A, "a@example.com"), "")
                .withUserAdded(new ProxyUser(USER_B, "b@example.com"), "");

        ProxyConfiguration updated = configuration.withUserRemoved(USER_A);

        assertFalse(updated.containsUser(USER_A));
        assertTrue(updated.containsUser(USER_B));
        assertSame(updated, updated.withUserRemoved(USER_A));
    }

    @Test
    void preservesUnmanagedFields() throws IOException {
        ProxyConfiguration updated = parse(DOCUMENT).withUserAdded(new ProxyUser(USER_A, null), "");

        JsonNode root = tree(updated);
        assertEquals("StatsService", root.path("api").path("services").get(0).asText());
        assertEquals("dokodemo-door", root.path("inbounds").get(0).path("protocol").asText());
        assertEquals("reality", root.path("inbounds").get(1).path("streamSettings").path("security").asText());
        assertEquals(parse(new String(updated.toBytes(), StandardCharsets.UTF_8)), updated);
    }

    @Test
    void rejectsDocumentsWithoutManagedInbound() {
        assertThrows(IOException.class, () -> parse("{\"inbounds\": []}"));
        assertThrows(IOException.class, () -> parse("[]"));
        assertThrows(IOException.class, () -> parse("{not json"));
    }

    @Test
    void bootstrapDocumentParses() throws IOException {
        ProxyConfiguration bootstrap = ProxyConfiguration.bootstrap("vless");

        assertEquals(bootstrap, parse(new String(bootstrap.toBytes(), StandardCharsets.UTF_8)));
        assertEquals(0, bootstrap.userCount());
    }

    private static ProxyConfiguration parse(String json) throws IOException {
        return ProxyConfiguration.parse(json.getBytes(StandardCharsets.UTF_8), "vless");
    }

    private static JsonNode tree(ProxyConfiguration configuration) throws IOException {
        return new ObjectMapper().readTree(configuration.toBytes());
    }
}
