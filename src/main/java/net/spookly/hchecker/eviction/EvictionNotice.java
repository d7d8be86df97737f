package net.spookly.hchecker.eviction;

import net.spookly.hchecker.check.Check;

/**
 * Dead-backend notification published by the proxy: {@code frontendKey;backendUrl;position;total}.
 */
public record EvictionNotice(String frontendKey, String backendUrl, int backendPosition, int totalBackends) {

    /**
     * Decode one notification line.
     *
     * @throws IllegalArgumentException when the line does not have four well-formed fields
     */
    public static EvictionNotice parse(String line) {
        if (line == null) {
            throw new IllegalArgumentException("eviction notice is required");
        }
        String[] fields = line.trim().split(";", -1);
        if (fields.length != 4) {
            throw new IllegalArgumentException("eviction notice must have 4 fields: " + line);
        }
        String frontendKey = fields[0];
        String backendUrl = fields[1];
        if (frontendKey.isEmpty() || backendUrl.isEmpty()) {
            throw new IllegalArgumentException("eviction notice has an empty frontend or backend: " + line);
        }
        int position = parseNumber(fields[2], "backend position", line);
        int total = parseNumber(fields[3], "backend count", line);
        if (position < 0 || total <= 0) {
            throw new IllegalArgumentException("eviction notice has an invalid position or count: " + line);
        }
        return new EvictionNotice(frontendKey, backendUrl, position, total);
    }

    /**
     * A fresh check for the evicted backend, ready to be locked.
     */
    public Check toCheck() {
        return new Check(backendUrl, frontendKey, backendPosition);
    }

    private static int parseNumber(String raw, String label, String line) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(label + " must be numeric: " + line, e);
        }
    }
}
