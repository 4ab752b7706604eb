package net.spookly.xrayagent.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.function.Function;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the agent YAML file into {@link AgentSettings}.
 * <p>
 * String values may reference the environment ({@code env:NAME}) or a file next to the config
 * ({@code path:secret/api_key}). Relative paths resolve against the config file's directory.
 */
public final class ConfigLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private ConfigLoader() {
    }

    /**
     * Load, default and validate the agent configuration. A missing file is replaced by the
     * default template and reported as an error, so the operator reviews it before the first start.
     */
    public static AgentSettings load(Path path) {
        return load(path, System::getenv);
    }

    static AgentSettings load(Path path, Function<String, String> environment) {
        if (path == null) {
            throw new ConfigException("Config path is required");
        }
        if (!Files.exists(path)) {
            writeTemplate(path);
            throw new ConfigException("Config file did not exist, generated default at: " + path
                    + " (set " + ConfigDefaults.SERVER_ID_ENV + " and " + ConfigDefaults.API_KEY_ENV
                    + ", then review it)");
        }
        Path baseDir = path.toAbsolutePath().getParent();
        Object expanded = EnvExpander.expand(readYaml(path), baseDir, environment);
        AgentSettings settings;
        try {
            settings = MAPPER.convertValue(expanded, AgentSettings.class);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Failed to parse config: " + path + ": " + e.getMessage(), e);
        }
        ConfigPathResolver.resolve(settings, baseDir);
        ConfigDefaults.applyDefaults(settings);
        ConfigValidator.validate(settings);
        return settings;
    }

    private static Object readYaml(Path path) {
        Object raw;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            raw = new Yaml().load(reader);
        } catch (IOException e) {
            throw new ConfigException("Failed to read config: " + path, e);
        } catch (YAMLException e) {
            throw new ConfigException("Config is not valid YAML: " + path + ": " + e.getMessage(), e);
        }
        if (raw == null) {
            throw new ConfigException("Config file is empty: " + path);
        }
        if (!(raw instanceof Map)) {
            throw new ConfigException("Config root must be a mapping: " + path);
        }
        return raw;
    }

    private static void writeTemplate(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, ConfigDefaults.defaultYaml(), StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
        } catch (IOException e) {
            throw new ConfigException("Failed to write default config: " + path, e);
        }
    }
}
