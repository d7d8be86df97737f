package net.spookly.hchecker.util;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Parsed host/port tuple of the coordination store.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class StoreAddress {
    private final String host;
    private final int port;

    /**
     * Parse a {@code host:port} store address.
     */
    public static StoreAddress parse(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("store address is required");
        }
        String value = raw.trim();
        int lastColon = value.lastIndexOf(':');
        if (lastColon <= 0 || lastColon == value.length() - 1) {
            throw new IllegalArgumentException("store address must be host:port: " + raw);
        }
        String host = value.substring(0, lastColon).trim();
        String portRaw = value.substring(lastColon + 1).trim();
        int port;
        try {
            port = Integer.parseInt(portRaw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("store port must be numeric: " + portRaw, e);
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("store port must be between 1 and 65535: " + port);
        }
        if (host.isEmpty()) {
            throw new IllegalArgumentException("store host is required");
        }
        return new StoreAddress(host, port);
    }

    /**
     * True for addresses that never leave the local machine.
     */
    public boolean isLoopback() {
        return "localhost".equalsIgnoreCase(host) || host.startsWith("127.") || "::1".equals(host);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
