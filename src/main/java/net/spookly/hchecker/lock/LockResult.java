package net.spookly.hchecker.lock;

import java.util.Optional;

import net.spookly.hchecker.mapping.MappingSignal;

/**
 * Outcome of a lock attempt. Only an owned result carries the owner's wake-up signal.
 */
public final class LockResult {
    private static final LockResult NOT_OWNED = new LockResult(false, null);

    private final boolean owned;
    private final MappingSignal signal;

    private LockResult(boolean owned, MappingSignal signal) {
        this.owned = owned;
        this.signal = signal;
    }

    static LockResult owned(MappingSignal signal) {
        return new LockResult(true, signal);
    }

    static LockResult notOwned() {
        return NOT_OWNED;
    }

    public boolean owned() {
        return owned;
    }

    public Optional<MappingSignal> signal() {
        return Optional.ofNullable(signal);
    }
}
