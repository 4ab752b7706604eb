package net.spookly.xrayagent.store;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import net.spookly.xrayagent.model.ProxyUser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigStoreTest {
    private static final String USER = "11111111-1111-1111-1111-111111111111";

    @Test
    void writesBootstrapDocumentWhenMissing(@TempDir Path tempDir) throws Exception {
        Path live = tempDir.resolve("xray").resolve("config.json");
        ConfigStore store = new ConfigStore(live, "vless");

        store.open();

        assertTrue(Files.exists(live));
        assertEquals(0, store.snapshot().userCount());
        assertEquals(store.snapshot(), store.read());
    }

    @Test
    void commitReplacesLiveDocument(@TempDir Path tempDir) throws Exception {
        ConfigStore store = new ConfigStore(tempDir.resolve("config.json"), "vless");
        store.open();
        ProxyConfiguration updated = store.snapshot().withUserAdded(new ProxyUser(USER, "a@example.com"), "");

        store.mutationLock().lock();
        try {
            store.commit(updated);
        } finally {
            store.mutationLock().unlock();
        }

        assertEquals(updated, store.read());
        assertEquals(updated, store.snapshot());
        assertEquals(0, countTempFiles(tempDir));
    }

    @Test
    void commitRequiresMutationLock(@TempDir Path tempDir) throws Exception {
        ConfigStore store = new ConfigStore(tempDir.resolve("config.json"), "vless");
        store.open();
        byte[] before = Files.readAllBytes(store.livePath());

        assertThrows(IllegalStateException.class, () -> store.commit(ProxyConfiguration.bootstrap("vless")
                .withUserAdded(new ProxyUser(USER, null), "")));

        assertArrayEquals(before, Files.readAllBytes(store.livePath()));
    }

    @Test
    void interruptedCommitLeavesPreviousDocument(@TempDir Path tempDir) throws Exception {
        Path live = tempDir.resolve("config.json");
        ConfigStore first = new ConfigStore(live, "vless");
        first.open();
        byte[] committed = Files.readAllBytes(live);
        // What a crash between writing the temp file and renaming it leaves behind.
        Path leftover = tempDir.resolve("config.json.3f2a.tmp");
        Files.writeString(leftover, "{\"inbounds\": [", StandardCharsets.UTF_8);

        ConfigStore reopened = new ConfigStore(live, "vless");
        reopened.open();

        assertFalse(Files.exists(leftover));
        assertArrayEquals(committed, Files.readAllBytes(live));
        assertEquals(0, reopened.snapshot().userCount());
    }

    @Test
    void corruptedDocumentFailsToOpen(@TempDir Path tempDir) throws Exception {
        Path live = tempDir.resolve("config.json");
        Files.writeString(live, "{ truncated", StandardCharsets.UTF_8);
        ConfigStore store = new ConfigStore(live, "vless");

        StorageCorruptedException exception = assertThrows(StorageCorruptedException.class, store::open);

        assertTrue(exception.getMessage().contains("unreadable"));
    }

    private static long countTempFiles(Path dir) throws Exception {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(path -> path.getFileName().toString().endsWith(".tmp")).count();
        }
    }
}
