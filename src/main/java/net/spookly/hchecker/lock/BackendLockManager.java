package net.spookly.hchecker.lock;

import java.time.Clock;
import java.util.Objects;

import net.spookly.hchecker.check.Check;
import net.spookly.hchecker.event.CheckerEvent;
import net.spookly.hchecker.event.CheckerEventListener;
import net.spookly.hchecker.event.CheckerEventType;
import net.spookly.hchecker.mapping.FrontendMappingTracker;
import net.spookly.hchecker.mapping.MappingSignal;
import net.spookly.hchecker.store.BestEffortWrites;
import net.spookly.hchecker.store.CheckerStore;
import net.spookly.hchecker.store.LockAttempt;
import net.spookly.hchecker.store.StoreException;
import net.spookly.hchecker.store.StoreKeys;
import net.spookly.hchecker.store.StoreResult;

/**
 * Per-backend exclusive ownership across checker processes, built on the store's atomic hash commands.
 *
 * <p>A backend whose lock record is set is owned by whichever checker wrote the sync marker
 * {@code backendUrl;checkerId}. A check from the owning checker joins the existing owner's mapping
 * instead of acquiring again, as long as that owner is still monitoring. Lock records carry no expiry: a crashed owner keeps its backends until
 * the lock hash is cleared.
 */
public final class BackendLockManager {
    private final CheckerStore store;
    private final FrontendMappingTracker tracker;
    private final String checkerId;
    private final OwnershipTokenIssuer tokenIssuer;
    private final CheckerEventListener eventListener;

    public BackendLockManager(CheckerStore store,
                              FrontendMappingTracker tracker,
                              String checkerId,
                              Clock clock,
                              CheckerEventListener eventListener) {
        this.store = Objects.requireNonNull(store, "store");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.checkerId = Objects.requireNonNull(checkerId, "checkerId");
        this.tokenIssuer = new OwnershipTokenIssuer(checkerId, clock);
        this.eventListener = eventListener == null ? CheckerEventListener.NOOP : eventListener;
    }

    /**
     * Try to take ownership of {@code check.backendUrl}.
     *
     * <p>On success the check carries the issued ownership token and the result carries the wake-up
     * signal for the owning loop. When this checker already owns or contests the backend, the check
     * is merged into the existing mapping and the result is not owned.
     *
     * @throws StoreException when the lock transaction cannot be executed
     */
    public LockResult lockBackend(Check check) {
        String backendUrl = check.backendUrl();
        String syncField = syncField(backendUrl);
        LockAttempt attempt = store.tryLock(backendUrl, syncField);
        if (!attempt.placeholderSet()) {
            if (!attempt.markerPresent()) {
                emit(CheckerEventType.LOCK_HELD_ELSEWHERE, check);
                return LockResult.notOwned();
            }
            if (tracker.joinFrontendMapping(check)) {
                emit(CheckerEventType.LOCK_JOINED, check);
            } else {
                // Owner already left; its release is still in flight.
                emit(CheckerEventType.LOCK_HELD_ELSEWHERE, check);
            }
            return LockResult.notOwned();
        }

        String token = tokenIssuer.issue();
        // Open the unit before the marker exists so joiners always find it.
        MappingSignal signal = tracker.openSignal(backendUrl);
        StoreResult claim = store.claimLock(backendUrl, syncField, token);
        if (!claim.isOk()) {
            reportWriteFailure(check, claim.failure());
            releaseQuietly(check, syncField);
            tracker.discard(backendUrl);
            return LockResult.notOwned();
        }
        tracker.updateFrontendMapping(check);
        check.attachOwnershipToken(token);
        emit(CheckerEventType.LOCK_ACQUIRED, check);
        return LockResult.owned(signal);
    }

    /**
     * True when the lock record no longer holds the token attached to {@code check}: the lock was
     * released, cleared or taken over. The owner must stop probing.
     *
     * @throws StoreException when the lock record cannot be read
     */
    public boolean isUnlockedBackend(Check check) {
        String current = store.lockValue(check.backendUrl());
        return !Objects.equals(current, check.ownershipToken());
    }

    /**
     * Release the lock and forget the backend's mapping. Safe to call when already unlocked.
     */
    public void unlockBackend(Check check) {
        String backendUrl = check.backendUrl();
        releaseQuietly(check, syncField(backendUrl));
        tracker.discard(backendUrl);
        emit(CheckerEventType.LOCK_RELEASED, check);
    }

    /**
     * Release the lock only while the record still holds the token attached to {@code check}.
     *
     * @return true when the lock was released
     * @throws StoreException when the lock record cannot be read
     */
    public boolean unlockIfOwned(Check check) {
        if (check.ownershipToken() == null || isUnlockedBackend(check)) {
            return false;
        }
        unlockBackend(check);
        return true;
    }

    public String checkerId() {
        return checkerId;
    }

    private String syncField(String backendUrl) {
        return StoreKeys.syncField(backendUrl, checkerId);
    }

    private void releaseQuietly(Check check, String syncField) {
        BestEffortWrites.attempt(
                () -> store.releaseLock(check.backendUrl(), syncField),
                failure -> reportWriteFailure(check, failure));
    }

    private void reportWriteFailure(Check check, StoreException failure) {
        eventListener.onEvent(CheckerEvent.of(CheckerEventType.STORE_WRITE_FAILED, checkerId, check.backendUrl())
                .withDetail(failure.getMessage()));
    }

    private void emit(CheckerEventType type, Check check) {
        eventListener.onEvent(CheckerEvent.of(type, checkerId, check.backendUrl(), check.frontendKey(),
                check.backendPosition()));
    }
}
