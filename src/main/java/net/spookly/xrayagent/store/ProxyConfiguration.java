package net.spookly.xrayagent.store;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.spookly.xrayagent.model.ProxyUser;

/**
 * Immutable view of the proxy's JSON configuration document.
 * <p>
 * Only the client list of the managed inbound is edited; every other field of the document is
 * carried through untouched. Mutators return a new instance and never modify this one.
 */
public final class ProxyConfiguration {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private static final String MANAGED_PROTOCOL = "vless";

    private final ObjectNode root;
    private final String inboundTag;

    private ProxyConfiguration(ObjectNode root, String inboundTag) {
        this.root = root;
        this.inboundTag = inboundTag;
    }

    /**
     * Parse a document and check that it carries the managed inbound.
     *
     * @throws IOException when the bytes are not a JSON object with a managed inbound
     */
    public static ProxyConfiguration parse(byte[] content, String inboundTag) throws IOException {
        JsonNode node;
        try {
            node = MAPPER.readTree(content);
        } catch (JsonProcessingException e) {
            throw new IOException("proxy config is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new IOException("proxy config must be a JSON object");
        }
        ProxyConfiguration configuration = new ProxyConfiguration((ObjectNode) node, inboundTag);
        if (configuration.findInbound(configuration.root) == null) {
            throw new IOException("proxy config has no inbound tagged '" + inboundTag + "' or using " + MANAGED_PROTOCOL);
        }
        return configuration;
    }

    /**
     * Minimal document with the managed inbound and no clients.
     */
    public static ProxyConfiguration bootstrap(String inboundTag) {
        ObjectNode root = MAPPER.createObjectNode();
        root.putObject("log").put("loglevel", "warning");
        ArrayNode inbounds = root.putArray("inbounds");
        ObjectNode inbound = inbounds.addObject();
        inbound.put("tag", inboundTag);
        inbound.put("listen", "0.0.0.0");
        inbound.put("port", 443);
        inbound.put("protocol", MANAGED_PROTOCOL);
        ObjectNode settings = inbound.putObject("settings");
        settings.putArray("clients");
        settings.put("decryption", "none");
        root.putArray("outbounds").addObject().put("protocol", "freedom");
        return new ProxyConfiguration(root, inboundTag);
    }

    public List<ProxyUser> users() {
        ArrayNode clients = clients(root);
        if (clients == null) {
            return List.of();
        }
        List<ProxyUser> users = new ArrayList<>(clients.size());
        for (JsonNode client : clients) {
            String id = client.path("id").asText(null);
            if (id == null) {
                continue;
            }
            users.add(new ProxyUser(id, client.path("email").asText(null)));
        }
        return Collections.unmodifiableList(users);
    }

    public boolean containsUser(String uuid) {
        return indexOf(clients(root), uuid) >= 0;
    }

    public int userCount() {
        ArrayNode clients = clients(root);
        return clients == null ? 0 : clients.size();
    }

    /**
     * Add a client entry, or return this document when the uuid is already present.
     * Any other client holding the same email is dropped, since the proxy rejects duplicate emails.
     *
     * @param flow value for the client's {@code flow} field, omitted when blank
     */
    public ProxyConfiguration withUserAdded(ProxyUser user, String flow) {
        if (containsUser(user.uuid())) {
            return this;
        }
        ObjectNode copy = root.deepCopy();
        ArrayNode clients = clientsForWrite(copy);
        String email = effectiveEmail(user);
        removeMatching(clients, client -> email.equals(client.path("email").asText(null)));
        ObjectNode entry = clients.addObject();
        entry.put("id", user.uuid());
        entry.put("email", email);
        if (flow != null && !flow.isBlank()) {
            entry.put("flow", flow);
        }
        return new ProxyConfiguration(copy, inboundTag);
    }

    /**
     * Remove a client entry, or return this document when the uuid is absent.
     */
    public ProxyConfiguration withUserRemoved(String uuid) {
        if (!containsUser(uuid)) {
            return this;
        }
        ObjectNode copy = root.deepCopy();
        removeMatching(clientsForWrite(copy), client -> uuid.equals(client.path("id").asText(null)));
        return new ProxyConfiguration(copy, inboundTag);
    }

    public byte[] toBytes() {
        try {
            return MAPPER.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize proxy config", e);
        }
    }

    /**
     * Email written for a new client: the supplied one, else {@code user-} plus the first 8 uuid characters.
     */
    public static String effectiveEmail(ProxyUser user) {
        if (user.email() != null && !user.email().isBlank()) {
            return user.email().trim();
        }
        String uuid = user.uuid();
        return "user-" + uuid.substring(0, Math.min(8, uuid.length()));
    }

    private ArrayNode clients(ObjectNode document) {
        ObjectNode inbound = findInbound(document);
        if (inbound == null) {
            return null;
        }
        JsonNode clients = inbound.path("settings").path("clients");
        return clients.isArray() ? (ArrayNode) clients : null;
    }

    private ArrayNode clientsForWrite(ObjectNode document) {
        ObjectNode inbound = findInbound(document);
        if (inbound == null) {
            throw new IllegalStateException("managed inbound missing");
        }
        JsonNode settings = inbound.get("settings");
        ObjectNode settingsNode = settings instanceof ObjectNode ? (ObjectNode) settings : inbound.putObject("settings");
        JsonNode clients = settingsNode.get("clients");
        return clients instanceof ArrayNode ? (ArrayNode) clients : settingsNode.putArray("clients");
    }

    private ObjectNode findInbound(ObjectNode document) {
        JsonNode inbounds = document.path("inbounds");
        if (!inbounds.isArray()) {
            return null;
        }
        ObjectNode byProtocol = null;
        for (JsonNode inbound : inbounds) {
            if (!inbound.isObject()) {
                continue;
            }
            if (inboundTag.equals(inbound.path("tag").asText(null))) {
                return (ObjectNode) inbound;
            }
            if (byProtocol == null && MANAGED_PROTOCOL.equals(inbound.path("protocol").asText(null))) {
                byProtocol = (ObjectNode) inbound;
            }
        }
        return byProtocol;
    }

    private static int indexOf(ArrayNode clients, String uuid) {
        if (clients == null || uuid == null) {
            return -1;
        }
        for (int i = 0; i < clients.size(); i++) {
            if (uuid.equals(clients.get(i).path("id").asText(null))) {
                return i;
            }
        }
        return -1;
    }

    private static void removeMatching(ArrayNode clients, java.util.function.Predicate<JsonNode> predicate) {
        for (int i = clients.size() - 1; i >= 0; i--) {
            if (predicate.test(clients.get(i))) {
                clients.remove(i);
            }
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ProxyConfiguration that)) {
            return false;
        }
        return root.equals(that.root) && inboundTag.equals(that.inboundTag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(root, inboundTag);
    }

    @Override
    public String toString() {
        return "ProxyConfiguration{users=" + userCount() + ", inboundTag=" + inboundTag + "}";
    }
}
