package net.spookly.xrayagent.util;

/**
 * Redacts API keys for logs and status output.
 */
public final class SecretRedactor {
    private static final String REDACTED = "REDACTED";
    private static final int VISIBLE_SUFFIX = 4;
    private static final int MIN_LENGTH_FOR_SUFFIX = 16;

    private SecretRedactor() {
    }

    /**
     * Return a safe representation of a secret. Long secrets keep their last four characters
     * so operators can tell keys apart.
     *
     * @param secret the raw secret value
     * @return {@code null} when the secret is {@code null}, otherwise a redacted form
     */
    public static String redact(String secret) {
        if (secret == null) {
            return null;
        }
        if (secret.isEmpty()) {
            return "";
        }
        if (secret.length() < MIN_LENGTH_FOR_SUFFIX) {
            return REDACTED;
        }
        return REDACTED + "..." + secret.substring(secret.length() - VISIBLE_SUFFIX);
    }
}
