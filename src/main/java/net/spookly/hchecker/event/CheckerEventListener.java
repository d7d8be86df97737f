package net.spookly.hchecker.event;

/**
 * Listener for checker audit events.
 */
@FunctionalInterface
public interface CheckerEventListener {
    CheckerEventListener NOOP = event -> {
    };

    void onEvent(CheckerEvent event);
}
