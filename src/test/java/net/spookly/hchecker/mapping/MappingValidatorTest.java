package net.spookly.hchecker.mapping;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import net.spookly.hchecker.check.Check;
import net.spookly.hchecker.event.CheckerEvent;
import net.spookly.hchecker.event.CheckerEventType;
import net.spookly.hchecker.store.InMemoryCheckerStore;
import net.spookly.hchecker.store.StoreException;
import org.junit.jupiter.api.Test;

class MappingValidatorTest {
    private static final String BACKEND = "http://10.0.0.1:80";

    @Test
    void acceptsAssociationMatchingAuthoritativeList() {
        InMemoryCheckerStore store = new InMemoryCheckerStore();
        store.setFrontend("www.example.com", "www", BACKEND, "http://10.0.0.2:80");
        MappingValidator validator = new MappingValidator(store, "p1", null);
        Map<String, Integer> mapping = new ConcurrentHashMap<>(Map.of("www.example.com", 0));

        assertTrue(validator.validate(new Check(BACKEND, "www.example.com", 0), "www.example.com", 0, mapping));
        assertEquals(Map.of("www.example.com", 0), mapping);
    }

    @Test
    void dropsAssociationWhenListMovedOn() {
        InMemoryCheckerStore store = new InMemoryCheckerStore();
        store.setFrontend("www.example.com", "www", "http://10.0.0.2:80");
        List<CheckerEvent> events = new ArrayList<>();
        MappingValidator validator = new MappingValidator(store, "p1", events::add);
        Map<String, Integer> mapping = new ConcurrentHashMap<>(Map.of("www.example.com", 0, "api.example.com", 4));

        assertFalse(validator.validate(new Check(BACKEND, "www.example.com", 0), "www.example.com", 0, mapping));

        assertEquals(Map.of("api.example.com", 4), mapping);
        assertEquals(CheckerEventType.MAPPING_DROPPED, events.get(0).type());
        assertEquals("www.example.com", events.get(0).frontendKey());
    }

    @Test
    void readsEntryAfterReservedSlot() {
        InMemoryCheckerStore store = new InMemoryCheckerStore();
        store.setFrontend("www.example.com", BACKEND);
        MappingValidator validator = new MappingValidator(store, "p1", null);
        Map<String, Integer> mapping = new ConcurrentHashMap<>(Map.of("www.example.com", 0));

        assertFalse(validator.validate(new Check(BACKEND, "www.example.com", 0), "www.example.com", 0, mapping));
        assertTrue(mapping.isEmpty());
    }

    @Test
    void dropsAssociationForDeletedFrontend() {
        InMemoryCheckerStore store = new InMemoryCheckerStore();
        MappingValidator validator = new MappingValidator(store, "p1", null);
        Map<String, Integer> mapping = new ConcurrentHashMap<>(Map.of("gone.example.com", 1));

        assertFalse(validator.validate(new Check(BACKEND, "gone.example.com", 1), "gone.example.com", 1, mapping));
        assertTrue(mapping.isEmpty());
    }

    @Test
    void keepsMappingWhenListCannotBeRead() {
        InMemoryCheckerStore store = new InMemoryCheckerStore();
        store.failReads(true);
        MappingValidator validator = new MappingValidator(store, "p1", null);
        Map<String, Integer> mapping = new ConcurrentHashMap<>(Map.of("www.example.com", 0));

        assertThrows(StoreException.class,
                () -> validator.validate(new Check(BACKEND, "www.example.com", 0), "www.example.com", 0, mapping));
        assertEquals(Map.of("www.example.com", 0), mapping);
    }
}
