package net.spookly.hchecker.mapping;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Frontends served by one backend (frontend key to backend position) plus the owner's wake-up signal.
 */
public final class BackendMapping {
    private final Map<String, Integer> frontends = new ConcurrentHashMap<>();
    private volatile MappingSignal signal;

    /**
     * Live view of frontend key to backend position. Entries may be removed by validation.
     */
    public Map<String, Integer> frontends() {
        return frontends;
    }

    public MappingSignal signal() {
        return signal;
    }

    MappingSignal openSignal() {
        MappingSignal opened = new MappingSignal();
        signal = opened;
        return opened;
    }

    void put(String frontendKey, int position) {
        frontends.put(frontendKey, position);
        MappingSignal current = signal;
        if (current != null) {
            current.signal();
        }
    }

    public boolean isEmpty() {
        return frontends.isEmpty();
    }
}
