package net.spookly.hchecker.store;

import java.util.function.Consumer;

/**
 * Fire-and-forget wrapper for store writes whose failure must not interrupt the caller
 * (heartbeats, lock cleanup).
 */
public final class BestEffortWrites {
    private BestEffortWrites() {
    }

    /**
     * Run {@code write}, handing any store failure to {@code onFailure} instead of throwing.
     *
     * @return true when the write completed
     */
    public static boolean attempt(Runnable write, Consumer<StoreException> onFailure) {
        try {
            write.run();
            return true;
        } catch (StoreException e) {
            onFailure.accept(e);
            return false;
        }
    }
}
