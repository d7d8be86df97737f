package net.spookly.hchecker.monitor;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import net.spookly.hchecker.check.Check;
import net.spookly.hchecker.config.ConfigDefaults;
import net.spookly.hchecker.config.HcheckerConfig;
import net.spookly.hchecker.lock.BackendLockManager;
import net.spookly.hchecker.lock.LockResult;
import net.spookly.hchecker.mapping.MappingSignal;
import net.spookly.hchecker.state.BackendStateReporter;
import net.spookly.hchecker.store.StoreException;

/**
 * Probe/report loop for one backend whose lock is held by this checker.
 *
 * <p>Each cycle verifies the lock is still ours, probes, and publishes the outcome. The loop ends
 * when the lock is lost, when no frontend maps to the backend anymore, or on {@link #stop()}. Only
 * the stop and interrupt paths release the lock here: a lost lock belongs to someone else, and the
 * state reporter already released it when the mapping ran empty.
 */
public final class BackendMonitor implements Runnable {
    private final Check check;
    private final MappingSignal signal;
    private final BackendLockManager lockManager;
    private final BackendStateReporter stateReporter;
    private final BackendProbe probe;
    private final Duration interval;
    private final int probeTimeoutMs;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public BackendMonitor(Check check,
                          MappingSignal signal,
                          BackendLockManager lockManager,
                          BackendStateReporter stateReporter,
                          BackendProbe probe,
                          Duration interval,
                          int probeTimeoutMs) {
        this.check = Objects.requireNonNull(check, "check");
        this.signal = Objects.requireNonNull(signal, "signal");
        this.lockManager = Objects.requireNonNull(lockManager, "lockManager");
        this.stateReporter = Objects.requireNonNull(stateReporter, "stateReporter");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.probeTimeoutMs = probeTimeoutMs;
    }

    /**
     * Monitor for a check that just won its lock, paced by the {@code checker} config section.
     */
    public static BackendMonitor forLockedCheck(Check check,
                                                LockResult lockResult,
                                                BackendLockManager lockManager,
                                                BackendStateReporter stateReporter,
                                                BackendProbe probe,
                                                HcheckerConfig config) {
        MappingSignal signal = lockResult.signal()
                .orElseThrow(() -> new IllegalArgumentException("lock is not owned: " + check));
        HcheckerConfig.CheckerConfig checker = config.checker == null ? new HcheckerConfig.CheckerConfig() : config.checker;
        int intervalSeconds = ConfigDefaults.orDefault(checker.checkIntervalSeconds, ConfigDefaults.CHECK_INTERVAL_SECONDS);
        int timeoutMs = ConfigDefaults.orDefault(checker.probeTimeoutMs, ConfigDefaults.PROBE_TIMEOUT_MS);
        return new BackendMonitor(check, signal, lockManager, stateReporter, probe,
                Duration.ofSeconds(intervalSeconds), timeoutMs);
    }

    @Override
    public void run() {
        Cycle outcome = Cycle.STOPPED;
        try {
            while (!stopped.get()) {
                Cycle cycle = runOnce();
                if (cycle != Cycle.CONTINUE) {
                    outcome = cycle;
                    break;
                }
                // Wakes early when a frontend joins.
                signal.await(interval);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (outcome == Cycle.STOPPED) {
            releaseIfOwned();
        }
    }

    /**
     * Run a single probe/report cycle.
     */
    Cycle runOnce() throws InterruptedException {
        try {
            if (lockManager.isUnlockedBackend(check)) {
                return Cycle.OWNERSHIP_LOST;
            }
            boolean alive = probeOnce();
            if (stopped.get()) {
                return Cycle.STOPPED;
            }
            boolean tracked = alive ? stateReporter.markBackendAlive(check) : stateReporter.markBackendDead(check);
            return tracked ? Cycle.CONTINUE : Cycle.UNMAPPED;
        } catch (StoreException e) {
            System.err.println("Monitoring cycle failed for " + check.backendUrl() + ": " + e.getMessage());
            return Cycle.CONTINUE;
        }
    }

    public void stop() {
        stopped.set(true);
        signal.signal();
    }

    private void releaseIfOwned() {
        try {
            lockManager.unlockIfOwned(check);
        } catch (StoreException e) {
            System.err.println("Failed to release " + check.backendUrl() + " on stop: " + e.getMessage());
        }
    }

    private boolean probeOnce() throws InterruptedException {
        try {
            Boolean result = probe.probe(check, probeTimeoutMs).get(probeTimeoutMs + 1000L, TimeUnit.MILLISECONDS);
            return Boolean.TRUE.equals(result);
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            return false;
        }
    }

    /**
     * Why a cycle ended.
     */
    enum Cycle {
        /** Keep monitoring. */
        CONTINUE,
        /** The lock record holds another token; the lock is left alone. */
        OWNERSHIP_LOST,
        /** No frontend maps to the backend anymore; the state reporter already released the lock. */
        UNMAPPED,
        /** Stopped or interrupted; the lock is released if still ours. */
        STOPPED
    }
}
