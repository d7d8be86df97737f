package net.spookly.hchecker.heartbeat;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import net.spookly.hchecker.event.CheckerEvent;
import net.spookly.hchecker.event.CheckerEventType;
import net.spookly.hchecker.store.InMemoryCheckerStore;
import org.junit.jupiter.api.Test;

class HeartbeatReporterTest {
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1700000000L), ZoneOffset.UTC);

    @Test
    void writesCurrentEpochSecond() {
        InMemoryCheckerStore store = new InMemoryCheckerStore();
        try (HeartbeatReporter reporter = new HeartbeatReporter(store, CLOCK, "p1", null)) {
            assertTrue(reporter.pingAlive());
            assertEquals("1700000000", store.heartbeat());
        }
    }

    @Test
    void absorbsStoreFailure() {
        InMemoryCheckerStore store = new InMemoryCheckerStore();
        store.failWrites(true);
        List<CheckerEvent> events = new ArrayList<>();
        try (HeartbeatReporter reporter = new HeartbeatReporter(store, CLOCK, "p1", events::add)) {
            assertFalse(reporter.pingAlive());
            assertNull(store.heartbeat());
            assertEquals(CheckerEventType.STORE_WRITE_FAILED, events.get(0).type());
        }
    }

    @Test
    void startPingsImmediately() throws InterruptedException {
        InMemoryCheckerStore store = new InMemoryCheckerStore();
        try (HeartbeatReporter reporter = new HeartbeatReporter(store, CLOCK, "p1", null)) {
            reporter.start(60);
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (store.heartbeat() == null && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertEquals("1700000000", store.heartbeat());
        }
    }
}
