package net.spookly.hchecker.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import net.spookly.hchecker.check.Check;
import net.spookly.hchecker.event.CheckerEvent;
import net.spookly.hchecker.event.CheckerEventType;
import net.spookly.hchecker.lock.BackendLockManager;
import net.spookly.hchecker.mapping.FrontendMappingTracker;
import net.spookly.hchecker.mapping.MappingValidator;
import net.spookly.hchecker.store.InMemoryCheckerStore;
import org.junit.jupiter.api.Test;

class BackendStateReporterTest {
    private static final String BACKEND = "http://10.0.0.1:80";

    private final InMemoryCheckerStore store = new InMemoryCheckerStore();
    private final FrontendMappingTracker tracker = new FrontendMappingTracker();
    private final List<CheckerEvent> events = new ArrayList<>();
    private final BackendLockManager lockManager =
            new BackendLockManager(store, tracker, "p1", Clock.systemUTC(), events::add);
    private final BackendStateReporter reporter = new BackendStateReporter(
            store, tracker, new MappingValidator(store, "p1", events::add), lockManager, events::add);

    @Test
    void marksEveryValidFrontendDeadWithExpiry() {
        store.setFrontend("www.example.com", "www", BACKEND);
        store.setFrontend("api.example.com", "api", "http://10.0.0.9:80", "http://10.0.0.8:80", BACKEND);
        Check check = new Check(BACKEND, "www.example.com", 0);
        assertTrue(lockManager.lockBackend(check).owned());
        lockManager.lockBackend(new Check(BACKEND, "api.example.com", 2));

        assertTrue(reporter.markBackendDead(check));

        assertEquals(Set.of("0"), store.deadSet("www.example.com"));
        assertEquals(Set.of("2"), store.deadSet("api.example.com"));
        assertEquals(BackendStateReporter.DEAD_TTL_SECONDS, store.deadTtl("www.example.com"));
        assertEquals(60, store.deadTtl("api.example.com"));
    }

    @Test
    void marksBackendAliveAgain() {
        store.setFrontend("www.example.com", "www", BACKEND);
        Check check = new Check(BACKEND, "www.example.com", 0);
        lockManager.lockBackend(check);
        reporter.markBackendDead(check);

        assertTrue(reporter.markBackendAlive(check));

        assertTrue(store.deadSet("www.example.com").isEmpty());
        assertTrue(events.stream().anyMatch(event -> event.type() == CheckerEventType.BACKEND_ALIVE));
    }

    @Test
    void skipsStaleFrontendButKeepsMonitoring() {
        store.setFrontend("www.example.com", "www", BACKEND);
        store.setFrontend("api.example.com", "api", "http://10.0.0.2:80");
        Check check = new Check(BACKEND, "www.example.com", 0);
        lockManager.lockBackend(check);
        lockManager.lockBackend(new Check(BACKEND, "api.example.com", 0));

        assertTrue(reporter.markBackendDead(check));

        assertEquals(Set.of("0"), store.deadSet("www.example.com"));
        assertTrue(store.deadSet("api.example.com").isEmpty());
        assertEquals(Map.of("www.example.com", 0), tracker.mapping(BACKEND).orElseThrow().frontends());
    }

    @Test
    void unlocksWhenLastMappingBecomesStale() {
        store.setFrontend("www.example.com", "www", "http://10.0.0.2:80");
        Check check = new Check(BACKEND, "www.example.com", 0);
        lockManager.lockBackend(check);

        assertFalse(reporter.markBackendDead(check));

        assertTrue(store.deadSet("www.example.com").isEmpty());
        assertTrue(tracker.mapping(BACKEND).isEmpty());
        assertFalse(store.lockHash().containsKey(BACKEND));
        assertFalse(store.lockHash().containsKey(BACKEND + ";p1"));
    }

    @Test
    void unlocksWhenNothingIsTracked() {
        Check check = new Check(BACKEND, "www.example.com", 0);
        lockManager.lockBackend(check);
        tracker.discard(BACKEND);

        assertFalse(reporter.markBackendAlive(check));
        assertFalse(store.lockHash().containsKey(BACKEND));
    }

    @Test
    void reportsFailedTransactionAndKeepsMonitoring() {
        store.setFrontend("www.example.com", "www", BACKEND);
        Check check = new Check(BACKEND, "www.example.com", 0);
        lockManager.lockBackend(check);
        store.failWrites(true);

        assertTrue(reporter.markBackendDead(check));

        assertTrue(store.deadSet("www.example.com").isEmpty());
        assertTrue(events.stream().anyMatch(event -> event.type() == CheckerEventType.STORE_WRITE_FAILED));
    }
}
