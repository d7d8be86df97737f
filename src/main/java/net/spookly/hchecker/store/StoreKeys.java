package net.spookly.hchecker.store;

/**
 * Key layout shared with the proxy layer. Must not change.
 */
public final class StoreKeys {
    public static final String LOCK_HASH = "hchecker";
    public static final String HEARTBEAT = "hchecker_ping";
    public static final String LOCK_PLACEHOLDER = "1";
    public static final String MARKER_VALUE = "1";

    private static final String DEAD_PREFIX = "dead:";
    private static final String FRONTEND_PREFIX = "frontend:";

    private StoreKeys() {
    }

    /**
     * Hash field recording that {@code checkerId} holds or contests the lock of {@code backendUrl}.
     */
    public static String syncField(String backendUrl, String checkerId) {
        return backendUrl + ";" + checkerId;
    }

    public static String deadSet(String frontendKey) {
        return DEAD_PREFIX + frontendKey;
    }

    public static String frontendList(String frontendKey) {
        return FRONTEND_PREFIX + frontendKey;
    }

    /**
     * Index in the frontend list that holds the backend at {@code position}. Slot 0 is reserved.
     */
    public static long frontendListIndex(int position) {
        return position + 1L;
    }
}
