package net.spookly.hchecker.eviction;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import net.spookly.hchecker.event.CheckerEvent;
import net.spookly.hchecker.event.CheckerEventListener;
import net.spookly.hchecker.event.CheckerEventType;
import net.spookly.hchecker.store.ChannelSubscription;
import net.spookly.hchecker.store.CheckerStore;
import net.spookly.hchecker.store.StoreException;

/**
 * Background subscription to the proxy's dead-backend channel.
 *
 * <p>On a transport failure the subscription is closed, the listener waits the policy's backoff,
 * opens a fresh connection and resubscribes. Failures never reach the caller; the loop only ends on
 * {@link #stop()} or when the policy's attempt limit is exhausted.
 */
public final class EvictionListener implements AutoCloseable {
    private static final long STOP_JOIN_MS = 1000;

    private final CheckerStore store;
    private final ReconnectPolicy policy;
    private final String checkerId;
    private final CheckerEventListener eventListener;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final CountDownLatch stopLatch = new CountDownLatch(1);
    private volatile ChannelSubscription active;
    private volatile Thread worker;

    public EvictionListener(CheckerStore store,
                            ReconnectPolicy policy,
                            String checkerId,
                            CheckerEventListener eventListener) {
        this.store = Objects.requireNonNull(store, "store");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.checkerId = Objects.requireNonNull(checkerId, "checkerId");
        this.eventListener = eventListener == null ? CheckerEventListener.NOOP : eventListener;
    }

    /**
     * Start delivering every message published on {@code channel} to {@code callback}.
     */
    public void listen(String channel, Consumer<String> callback) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(callback, "callback");
        if (stopped.get() || !started.compareAndSet(false, true)) {
            throw new IllegalStateException("eviction listener already started");
        }
        Thread thread = threadFactory().newThread(() -> runLoop(channel, callback));
        worker = thread;
        thread.start();
    }

    /**
     * Stop listening: interrupts the backoff wait and unsubscribes.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        stopLatch.countDown();
        ChannelSubscription subscription = active;
        if (subscription != null) {
            subscription.close();
        }
        Thread thread = worker;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(STOP_JOIN_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        Thread thread = worker;
        return thread != null && thread.isAlive();
    }

    private void runLoop(String channel, Consumer<String> callback) {
        int failures = 0;
        boolean lost = false;
        while (!stopped.get()) {
            AtomicBoolean delivered = new AtomicBoolean(false);
            try {
                ChannelSubscription subscription = store.openSubscription(channel);
                active = subscription;
                try {
                    if (stopped.get()) {
                        return;
                    }
                    if (lost) {
                        emit(CheckerEventType.SUBSCRIPTION_RESTORED, channel);
                        lost = false;
                    }
                    subscription.run(message -> {
                        delivered.set(true);
                        deliver(callback, message);
                    });
                } finally {
                    active = null;
                    subscription.close();
                }
            } catch (StoreException e) {
                if (stopped.get()) {
                    return;
                }
                emit(CheckerEventType.SUBSCRIPTION_LOST, channel + ": " + e.getMessage());
                lost = true;
                failures = delivered.get() ? 1 : failures + 1;
                if (!policy.allowsRetry(failures)) {
                    System.err.println("Giving up on eviction channel " + channel + " after " + failures + " attempts");
                    return;
                }
            }
            if (stopped.get() || !awaitBackoff()) {
                return;
            }
        }
    }

    private void deliver(Consumer<String> callback, String message) {
        try {
            callback.accept(message);
        } catch (RuntimeException e) {
            System.err.println("Eviction callback failed for '" + message + "': " + e.getMessage());
        }
    }

    private boolean awaitBackoff() {
        try {
            return !stopLatch.await(policy.backoff().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void emit(CheckerEventType type, String detail) {
        eventListener.onEvent(CheckerEvent.of(type, checkerId, null).withDetail(detail));
    }

    private static ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "hchecker-eviction-listener");
            thread.setDaemon(true);
            return thread;
        };
    }
}
