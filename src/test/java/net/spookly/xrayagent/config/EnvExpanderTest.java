package net.spookly.xrayagent.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EnvExpanderTest {
    @Test
    void expandsEnvironmentAndPathValues(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("key.txt"), "from-file\n");
        Map<String, Object> raw = Map.of(
                "agent", Map.of("apiKey", "path:key.txt"),
                "list", List.of("env:CORE_URL", "plain")
        );

        Object expanded = EnvExpander.expand(raw, tempDir, name -> "CORE_URL".equals(name) ? "https://core" : null);

        Map<?, ?> root = (Map<?, ?>) expanded;
        assertEquals("from-file", ((Map<?, ?>) root.get("agent")).get("apiKey"));
        assertEquals(List.of("https://core", "plain"), root.get("list"));
    }

    @Test
    void failsOnMissingEnvironmentVariable(@TempDir Path tempDir) {
        ConfigException exception = assertThrows(ConfigException.class,
                () -> EnvExpander.expand("env:NOT_SET", tempDir, name -> null));

        assertEquals("Missing required environment variable: NOT_SET", exception.getMessage());
    }

    @Test
    void fallsBackWhenVariableIsUnset(@TempDir Path tempDir) {
        Object expanded = EnvExpander.expand(List.of("env:LOG_LEVEL:-info", "env:URL:-http://a:1"), tempDir,
                name -> "URL".equals(name) ? "https://core" : null);

        assertEquals(List.of("info", "https://core"), expanded);
    }

    @Test
    void emptyFileIsRejected(@TempDir Path tempDir) throws Exception {
        Files.writeString(tempDir.resolve("empty.txt"), "  \n");

        assertThrows(ConfigException.class, () -> EnvExpander.expand("path:empty.txt", tempDir, name -> null));
    }
}
