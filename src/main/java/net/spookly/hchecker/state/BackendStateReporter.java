package net.spookly.hchecker.state;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import net.spookly.hchecker.check.Check;
import net.spookly.hchecker.event.CheckerEvent;
import net.spookly.hchecker.event.CheckerEventListener;
import net.spookly.hchecker.event.CheckerEventType;
import net.spookly.hchecker.lock.BackendLockManager;
import net.spookly.hchecker.mapping.BackendMapping;
import net.spookly.hchecker.mapping.FrontendMappingTracker;
import net.spookly.hchecker.mapping.MappingValidator;
import net.spookly.hchecker.store.CheckerStore;
import net.spookly.hchecker.store.StoreResult;

/**
 * Publishes dead/alive transitions of a locked backend for every frontend that still maps to it.
 *
 * <p>Both operations return false once the backend has no valid frontend left; the backend is
 * unlocked at that point and the caller must stop monitoring it. Callers must own the backend's
 * lock before reporting.
 */
public final class BackendStateReporter {
    /**
     * Lifetime of a dead-set entry unless refreshed by another dead report.
     */
    public static final int DEAD_TTL_SECONDS = 60;

    private final CheckerStore store;
    private final FrontendMappingTracker tracker;
    private final MappingValidator validator;
    private final BackendLockManager lockManager;
    private final CheckerEventListener eventListener;

    public BackendStateReporter(CheckerStore store,
                                FrontendMappingTracker tracker,
                                MappingValidator validator,
                                BackendLockManager lockManager,
                                CheckerEventListener eventListener) {
        this.store = Objects.requireNonNull(store, "store");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.lockManager = Objects.requireNonNull(lockManager, "lockManager");
        this.eventListener = eventListener == null ? CheckerEventListener.NOOP : eventListener;
    }

    /**
     * Add the backend's position to {@code dead:<frontend>} for each valid frontend.
     *
     * @return false when the backend was unlocked because nothing maps to it anymore
     */
    public boolean markBackendDead(Check check) {
        return report(check, true);
    }

    /**
     * Remove the backend's position from {@code dead:<frontend>} for each valid frontend.
     *
     * @return false when the backend was unlocked because nothing maps to it anymore
     */
    public boolean markBackendAlive(Check check) {
        return report(check, false);
    }

    private boolean report(Check check, boolean dead) {
        Optional<BackendMapping> tracked = tracker.mapping(check.backendUrl());
        if (tracked.isEmpty()) {
            lockManager.unlockBackend(check);
            return false;
        }
        Map<String, Integer> frontends = tracked.get().frontends();
        Map<String, Integer> valid = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : Map.copyOf(frontends).entrySet()) {
            if (validator.validate(check, entry.getKey(), entry.getValue(), frontends)) {
                valid.put(entry.getKey(), entry.getValue());
            }
        }
        StoreResult result = dead ? store.markDead(valid, DEAD_TTL_SECONDS) : store.markAlive(valid);
        if (result.isOk()) {
            CheckerEventType type = dead ? CheckerEventType.BACKEND_DEAD : CheckerEventType.BACKEND_ALIVE;
            for (Map.Entry<String, Integer> entry : valid.entrySet()) {
                eventListener.onEvent(CheckerEvent.of(type, lockManager.checkerId(), check.backendUrl(),
                        entry.getKey(), entry.getValue()));
            }
        } else {
            eventListener.onEvent(CheckerEvent.of(CheckerEventType.STORE_WRITE_FAILED, lockManager.checkerId(),
                    check.backendUrl()).withDetail(result.failure().getMessage()));
        }
        if (frontends.isEmpty()) {
            lockManager.unlockBackend(check);
            return false;
        }
        return true;
    }
}
