package net.spookly.xrayagent.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Resolves indirect string values in the raw YAML tree before binding.
 * <ul>
 *     <li>{@code env:NAME} is the value of a required environment variable.</li>
 *     <li>{@code env:NAME:-fallback} uses the fallback when the variable is unset or empty.</li>
 *     <li>{@code path:file} is the trimmed content of a file, relative to the config directory.</li>
 * </ul>
 */
final class EnvExpander {
    private static final String ENV_PREFIX = "env:";
    private static final String PATH_PREFIX = "path:";
    private static final String FALLBACK_SEPARATOR = ":-";

    private EnvExpander() {
    }

    static Object expand(Object value, Path baseDir) {
        return expand(value, baseDir, System::getenv);
    }

    static Object expand(Object value, Path baseDir, Function<String, String> environment) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, item) -> copy.put(key, expand(item, baseDir, environment)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(expand(item, baseDir, environment)));
            return copy;
        }
        if (value instanceof String text) {
            if (text.startsWith(ENV_PREFIX)) {
                return fromEnvironment(text.substring(ENV_PREFIX.length()), environment);
            }
            if (text.startsWith(PATH_PREFIX)) {
                return fromFile(text.substring(PATH_PREFIX.length()), baseDir);
            }
        }
        return value;
    }

    private static String fromEnvironment(String reference, Function<String, String> environment) {
        int split = reference.indexOf(FALLBACK_SEPARATOR);
        String name = split < 0 ? reference : reference.substring(0, split);
        if (name.isBlank()) {
            throw new ConfigException("Environment reference without a variable name: env:" + reference);
        }
        String value = environment.apply(name);
        if (value != null && !value.isEmpty()) {
            return value;
        }
        if (split >= 0) {
            return reference.substring(split + FALLBACK_SEPARATOR.length());
        }
        throw new ConfigException("Missing required environment variable: " + name);
    }

    private static String fromFile(String location, Path baseDir) {
        if (location.isBlank()) {
            throw new ConfigException("Path value is empty");
        }
        Path file;
        try {
            file = Path.of(location);
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid path value: " + location, e);
        }
        if (baseDir != null && !file.isAbsolute()) {
            file = baseDir.resolve(file).normalize();
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new ConfigException("Failed to read config path: " + file, e);
        }
        if (content.isEmpty()) {
            throw new ConfigException("Path value is empty: " + file);
        }
        return content;
    }
}
