package net.spookly.xrayagent.util;

import java.net.InetSocketAddress;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Parsed {@code host:port} pair used for the command listener and the proxy management interface.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ListenAddress {
    private final String host;
    private final int port;

    /**
     * Parse a {@code host:port} string. IPv6 hosts may be bracketed.
     */
    public static ListenAddress parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("address is required");
        }
        String value = raw.trim();
        int separator = value.lastIndexOf(':');
        if (separator <= 0 || separator == value.length() - 1) {
            throw new IllegalArgumentException("address must be host:port: " + raw);
        }
        String host = value.substring(0, separator).trim();
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        if (host.isEmpty()) {
            throw new IllegalArgumentException("host is required: " + raw);
        }
        int port;
        try {
            port = Integer.parseInt(value.substring(separator + 1).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("port must be numeric: " + raw, e);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 0 and 65535: " + port);
        }
        return new ListenAddress(host, port);
    }

    /**
     * Socket address for binding or connecting.
     */
    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(host, port);
    }

    @Override
    public String toString() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }
}
