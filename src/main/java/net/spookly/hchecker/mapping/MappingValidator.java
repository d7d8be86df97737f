package net.spookly.hchecker.mapping;

import java.util.Map;
import java.util.Objects;

import net.spookly.hchecker.check.Check;
import net.spookly.hchecker.event.CheckerEvent;
import net.spookly.hchecker.event.CheckerEventListener;
import net.spookly.hchecker.event.CheckerEventType;
import net.spookly.hchecker.store.CheckerStore;
import net.spookly.hchecker.store.StoreKeys;

/**
 * Re-checks an in-process frontend association against the authoritative frontend list.
 */
public final class MappingValidator {
    private final CheckerStore store;
    private final String checkerId;
    private final CheckerEventListener eventListener;

    public MappingValidator(CheckerStore store, String checkerId, CheckerEventListener eventListener) {
        this.store = Objects.requireNonNull(store, "store");
        this.checkerId = Objects.requireNonNull(checkerId, "checkerId");
        this.eventListener = eventListener == null ? CheckerEventListener.NOOP : eventListener;
    }

    /**
     * True when the authoritative list still holds {@code check.backendUrl} for {@code position}.
     * A stale association is removed from {@code mapping}.
     *
     * @throws net.spookly.hchecker.store.StoreException when the list cannot be read; the mapping is left untouched
     */
    public boolean validate(Check check, String frontendKey, int position, Map<String, Integer> mapping) {
        String current = store.authoritativeBackend(frontendKey, StoreKeys.frontendListIndex(position));
        if (check.backendUrl().equals(current)) {
            return true;
        }
        mapping.remove(frontendKey, position);
        eventListener.onEvent(CheckerEvent.of(
                CheckerEventType.MAPPING_DROPPED, checkerId, check.backendUrl(), frontendKey, position)
                .withDetail("authoritative=" + current));
        return false;
    }
}
