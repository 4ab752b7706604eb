package net.spookly.xrayagent.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves relative file settings against the config directory.
 */
final class ConfigPathResolver {
    private static final String DEFAULT_SCRATCH_DIR = ".scratch";

    private ConfigPathResolver() {
    }

    static void resolve(AgentSettings settings, Path baseDir) {
        if (settings == null || settings.xray == null) {
            return;
        }
        AgentSettings.XrayConfig xray = settings.xray;
        if (baseDir != null) {
            xray.configPath = resolvePath(baseDir, xray.configPath);
            xray.scratchDir = resolvePath(baseDir, xray.scratchDir);
        }
        if (isBlank(xray.scratchDir) && !isBlank(xray.configPath)) {
            Path parent = Paths.get(xray.configPath).toAbsolutePath().getParent();
            xray.scratchDir = parent.resolve(DEFAULT_SCRATCH_DIR).toString();
        }
    }

    private static String resolvePath(Path baseDir, String rawValue) {
        if (isBlank(rawValue)) {
            return rawValue;
        }
        try {
            Path path = Paths.get(rawValue);
            if (!path.isAbsolute()) {
                path = baseDir.resolve(path).normalize();
            }
            return path.toString();
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid path value: " + rawValue, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
