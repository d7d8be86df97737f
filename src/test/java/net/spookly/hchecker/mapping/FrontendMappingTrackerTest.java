package net.spookly.hchecker.mapping;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;

import net.spookly.hchecker.check.Check;
import org.junit.jupiter.api.Test;

class FrontendMappingTrackerTest {
    private static final String BACKEND = "http://10.0.0.1:80";

    @Test
    void mergesFrontendsPerBackend() {
        FrontendMappingTracker tracker = new FrontendMappingTracker();

        tracker.updateFrontendMapping(new Check(BACKEND, "www.example.com", 0));
        tracker.updateFrontendMapping(new Check(BACKEND, "api.example.com", 1));
        tracker.updateFrontendMapping(new Check(BACKEND, "www.example.com", 2));
        tracker.updateFrontendMapping(new Check("http://10.0.0.2:80", "www.example.com", 1));

        assertEquals(Map.of("www.example.com", 2, "api.example.com", 1),
                tracker.mapping(BACKEND).orElseThrow().frontends());
        assertEquals(2, tracker.trackedBackends());
    }

    @Test
    void signalsOwnerWithoutBlockingAndCoalesces() throws InterruptedException {
        FrontendMappingTracker tracker = new FrontendMappingTracker();
        MappingSignal signal = tracker.openSignal(BACKEND);

        tracker.updateFrontendMapping(new Check(BACKEND, "www.example.com", 0));
        tracker.updateFrontendMapping(new Check(BACKEND, "api.example.com", 1));
        tracker.updateFrontendMapping(new Check(BACKEND, "cdn.example.com", 2));

        assertTrue(signal.await(Duration.ofMillis(10)));
        assertFalse(signal.poll());
    }

    @Test
    void updateWithoutOwnerDoesNotCreateSignal() {
        FrontendMappingTracker tracker = new FrontendMappingTracker();

        tracker.updateFrontendMapping(new Check(BACKEND, "www.example.com", 0));

        assertEquals(null, tracker.mapping(BACKEND).orElseThrow().signal());
    }

    @Test
    void discardDropsMappingAndSignal() {
        FrontendMappingTracker tracker = new FrontendMappingTracker();
        tracker.openSignal(BACKEND);
        tracker.updateFrontendMapping(new Check(BACKEND, "www.example.com", 0));

        tracker.discard(BACKEND);
        tracker.discard(BACKEND);

        assertTrue(tracker.mapping(BACKEND).isEmpty());
        assertEquals(0, tracker.trackedBackends());
    }

    @Test
    void joinOnlyMergesIntoLiveMapping() {
        FrontendMappingTracker tracker = new FrontendMappingTracker();
        tracker.openSignal(BACKEND);

        assertTrue(tracker.joinFrontendMapping(new Check(BACKEND, "www.example.com", 0)));
        tracker.discard(BACKEND);

        assertFalse(tracker.joinFrontendMapping(new Check(BACKEND, "api.example.com", 1)));
        assertTrue(tracker.mapping(BACKEND).isEmpty());
    }
}
