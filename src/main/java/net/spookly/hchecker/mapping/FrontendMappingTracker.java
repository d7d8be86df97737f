package net.spookly.hchecker.mapping;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import net.spookly.hchecker.check.Check;

/**
 * In-process association of backend URL to the frontends it serves.
 *
 * <p>A backend's unit is only mutated by the checker holding that backend's lock (or by a check of
 * this same checker joining it). Units themselves are created and removed atomically.
 */
public final class FrontendMappingTracker {
    private final Map<String, BackendMapping> mappings = new ConcurrentHashMap<>();

    /**
     * Merge {@code check.frontendKey -> check.backendPosition} into the backend's mapping and wake
     * the owner if it is listening.
     */
    public void updateFrontendMapping(Check check) {
        mappings.compute(check.backendUrl(), (url, existing) -> {
            BackendMapping mapping = existing == null ? new BackendMapping() : existing;
            mapping.put(check.frontendKey(), check.backendPosition());
            return mapping;
        });
    }

    /**
     * Merge {@code check} into a mapping that already exists. A backend whose owner already
     * discarded its mapping is not recreated.
     *
     * @return true when the check was merged
     */
    public boolean joinFrontendMapping(Check check) {
        BackendMapping joined = mappings.computeIfPresent(check.backendUrl(), (url, existing) -> {
            existing.put(check.frontendKey(), check.backendPosition());
            return existing;
        });
        return joined != null;
    }

    /**
     * Create a fresh wake-up signal for a backend that was just locked.
     */
    public MappingSignal openSignal(String backendUrl) {
        BackendMapping mapping = mappings.computeIfAbsent(backendUrl, url -> new BackendMapping());
        return mapping.openSignal();
    }

    public Optional<BackendMapping> mapping(String backendUrl) {
        return Optional.ofNullable(mappings.get(backendUrl));
    }

    /**
     * Drop the mapping and the signal of a backend.
     */
    public void discard(String backendUrl) {
        mappings.remove(backendUrl);
    }

    public int trackedBackends() {
        return mappings.size();
    }
}
