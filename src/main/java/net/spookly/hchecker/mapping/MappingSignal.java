package net.spookly.hchecker.mapping;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * One-slot wake-up channel telling the lock owner that the frontend mapping changed.
 *
 * <p>Signals coalesce: the owner only learns that something changed, not how often.
 */
public final class MappingSignal {
    private final BlockingQueue<Boolean> slot = new ArrayBlockingQueue<>(1);

    /**
     * Non-blocking send; dropped when a signal is already pending.
     */
    public void signal() {
        slot.offer(Boolean.TRUE);
    }

    /**
     * Consume a pending signal or wait for one up to {@code timeout}.
     *
     * @return true when a signal was consumed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return slot.poll(timeout.toMillis(), TimeUnit.MILLISECONDS) != null;
    }

    /**
     * Consume a pending signal without waiting.
     */
    public boolean poll() {
        return slot.poll() != null;
    }
}
