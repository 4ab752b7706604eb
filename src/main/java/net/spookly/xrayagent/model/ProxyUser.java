package net.spookly.xrayagent.model;

import lombok.NonNull;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * A client entitled to connect through the proxy, keyed by {@code uuid}.
 */
@Value
@Accessors(fluent = true)
public class ProxyUser {
    @NonNull
    String uuid;
    String email;
}
