package net.spookly.hchecker.monitor;

import java.util.concurrent.CompletableFuture;

import net.spookly.hchecker.check.Check;

/**
 * Executes an active probe against a backend to determine reachability.
 */
public interface BackendProbe extends AutoCloseable {
    /**
     * Probe the check's backend and complete with true when it is reachable.
     */
    CompletableFuture<Boolean> probe(Check check, int timeoutMs);

    @Override
    default void close() {
    }
}
