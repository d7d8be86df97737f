package net.spookly.hchecker.store;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Outcome of a required store write. Callers must inspect {@link #isOk()}.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class StoreResult {
    private static final StoreResult OK = new StoreResult(null);

    private final StoreException failure;

    public static StoreResult ok() {
        return OK;
    }

    public static StoreResult failed(StoreException failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure is required");
        }
        return new StoreResult(failure);
    }

    public boolean isOk() {
        return failure == null;
    }
}
