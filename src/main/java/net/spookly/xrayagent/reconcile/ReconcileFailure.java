package net.spookly.xrayagent.reconcile;

/**
 * Why a command could not be reconciled. The live document is unchanged in every case.
 */
public enum ReconcileFailure {
    /**
     * The proxy's configuration test rejected the candidate.
     */
    INVALID_CONFIG("invalid_config"),
    /**
     * The live document could not be read or committed after the bounded retries.
     */
    STORAGE_UNAVAILABLE("storage_unavailable"),
    /**
     * Validation or reload did not finish within the operation timeout.
     */
    TIMEOUT("timeout"),
    /**
     * The proxy's validate or reload command could not be run at all.
     */
    PROXY_UNAVAILABLE("proxy_unavailable");

    private final String wireName;

    ReconcileFailure(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
