package net.spookly.hchecker.store;

import java.util.Map;

/**
 * Store operations used by the checker core. Every method maps onto the key layout in {@link StoreKeys}.
 */
public interface CheckerStore extends AutoCloseable {
    /**
     * In one transaction, set the lock record of {@code backendUrl} to the placeholder if absent and
     * test whether {@code syncField} exists.
     *
     * @throws StoreException when the transaction cannot be executed
     */
    LockAttempt tryLock(String backendUrl, String syncField);

    /**
     * Write the ownership token and the sync marker in one command.
     */
    StoreResult claimLock(String backendUrl, String syncField, String token);

    /**
     * Current lock record value, or null when absent.
     *
     * @throws StoreException when the read fails
     */
    String lockValue(String backendUrl);

    /**
     * Delete the lock record and the sync marker.
     *
     * @throws StoreException when the delete fails
     */
    void releaseLock(String backendUrl, String syncField);

    /**
     * Entry of the authoritative frontend list at {@code index}, or null when out of range.
     *
     * @throws StoreException when the read fails
     */
    String authoritativeBackend(String frontendKey, long index);

    /**
     * In one transaction, add each position to its frontend's dead set and refresh the set expiry.
     */
    StoreResult markDead(Map<String, Integer> positions, int ttlSeconds);

    /**
     * In one transaction, remove each position from its frontend's dead set.
     */
    StoreResult markAlive(Map<String, Integer> positions);

    /**
     * @throws StoreException when the write fails
     */
    void recordHeartbeat(long epochSeconds);

    /**
     * Drop every lock record and sync marker, including those of other checkers.
     *
     * @throws StoreException when the delete fails
     */
    void clearLocks();

    /**
     * Open a subscription on a dedicated connection.
     *
     * @throws StoreException when no connection can be acquired
     */
    ChannelSubscription openSubscription(String channel);

    @Override
    default void close() {
    }
}
