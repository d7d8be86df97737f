package net.spookly.hchecker.heartbeat;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import net.spookly.hchecker.event.CheckerEvent;
import net.spookly.hchecker.event.CheckerEventListener;
import net.spookly.hchecker.event.CheckerEventType;
import net.spookly.hchecker.store.BestEffortWrites;
import net.spookly.hchecker.store.CheckerStore;

/**
 * Records checker liveness as a timestamp under {@code hchecker_ping}.
 */
public final class HeartbeatReporter implements AutoCloseable {
    private final CheckerStore store;
    private final Clock clock;
    private final String checkerId;
    private final CheckerEventListener eventListener;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private ScheduledFuture<?> scheduledTask;

    public HeartbeatReporter(CheckerStore store, Clock clock, String checkerId, CheckerEventListener eventListener) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.checkerId = Objects.requireNonNull(checkerId, "checkerId");
        this.eventListener = eventListener == null ? CheckerEventListener.NOOP : eventListener;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory());
    }

    /**
     * Write the current epoch second. Failures are reported, never thrown.
     *
     * @return true when the timestamp was written
     */
    public boolean pingAlive() {
        long now = clock.instant().getEpochSecond();
        return BestEffortWrites.attempt(
                () -> store.recordHeartbeat(now),
                failure -> eventListener.onEvent(CheckerEvent.of(CheckerEventType.STORE_WRITE_FAILED, checkerId, null)
                        .withDetail("heartbeat: " + failure.getMessage())));
    }

    /**
     * Ping immediately and then every {@code intervalSeconds}.
     */
    public synchronized void start(int intervalSeconds) {
        if (stopped.get() || scheduledTask != null || intervalSeconds <= 0) {
            return;
        }
        scheduledTask = scheduler.scheduleAtFixedRate(this::pingAlive, 0, intervalSeconds, TimeUnit.SECONDS);
    }

    public synchronized void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (scheduledTask != null) {
            scheduledTask.cancel(false);
            scheduledTask = null;
        }
        scheduler.shutdownNow();
    }

    @Override
    public void close() {
        stop();
    }

    private static ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "hchecker-heartbeat");
            thread.setDaemon(true);
            return thread;
        };
    }
}
