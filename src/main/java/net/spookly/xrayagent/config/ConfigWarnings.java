package net.spookly.xrayagent.config;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.List;

/**
 * Non-fatal findings about a loaded configuration, logged once at startup.
 */
public final class ConfigWarnings {
    private ConfigWarnings() {
    }

    public static List<String> collect(AgentSettings settings, Path configPath) {
        List<String> warnings = new ArrayList<>();
        if (settings == null) {
            return warnings;
        }
        if (configPath != null) {
            checkNotWorldReadable(warnings, "config file", configPath);
        }
        if (settings.xray != null && settings.xray.configPath != null) {
            // Client ids in the proxy document are the users' credentials.
            checkNotWorldReadable(warnings, "xray.configPath", Paths.get(settings.xray.configPath));
        }
        if (settings.coreApi != null && settings.coreApi.url != null
                && settings.coreApi.url.toLowerCase().startsWith("http://")) {
            warnings.add("coreApi.url uses plain HTTP; the API key is sent in clear text");
        }
        if (settings.agent != null && isLoopback(settings.agent.url)) {
            warnings.add("agent.url points at a loopback address; the Core API will not be able to reach this agent");
        }
        if (settings.server != null && settings.server.rateLimitPerMinute != null
                && settings.server.rateLimitPerMinute == 0 && settings.server.listen != null
                && settings.server.listen.startsWith("0.0.0.0")) {
            warnings.add("server.rateLimitPerMinute is 0 on a public listener; failed API key attempts are not throttled");
        }
        return warnings;
    }

    private static boolean isLoopback(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            String host = URI.create(url).getHost();
            return host != null && (host.equals("localhost") || host.startsWith("127.") || host.equals("[::1]"));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static void checkNotWorldReadable(List<String> warnings, String label, Path path) {
        if (!Files.isRegularFile(path)) {
            return;
        }
        PosixFileAttributeView view = Files.getFileAttributeView(path, PosixFileAttributeView.class);
        if (view == null) {
            return;
        }
        try {
            if (view.readAttributes().permissions().contains(PosixFilePermission.OTHERS_READ)) {
                warnings.add(label + " is world-readable: " + path.toAbsolutePath());
            }
        } catch (IOException e) {
            warnings.add("could not read permissions of " + label + " " + path + ": " + e.getMessage());
        }
    }
}
