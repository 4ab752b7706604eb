package net.spookly.xrayagent.endpoint;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Shared-secret check for the {@code X-API-Key} header.
 */
public final class ApiKeyAuth {
    public static final String HEADER = "X-API-Key";

    private ApiKeyAuth() {
    }

    /**
     * Constant-time comparison of the presented key with the expected one.
     */
    public static boolean matches(String expected, String presented) {
        if (expected == null || expected.isEmpty() || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.trim().getBytes(StandardCharsets.UTF_8));
    }
}
