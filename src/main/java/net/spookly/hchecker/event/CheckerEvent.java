package net.spookly.hchecker.event;

import lombok.Value;
import lombok.experimental.Accessors;

import java.time.Instant;

/**
 * Snapshot of a lock, mapping or state change for audit logging.
 */
@Value
@Accessors(fluent = true)
public class CheckerEvent {
    CheckerEventType type;
    Instant timestamp;
    String checkerId;
    String backendUrl;
    String frontendKey;
    Integer position;
    String detail;

    public static CheckerEvent of(CheckerEventType type, String checkerId, String backendUrl) {
        return new CheckerEvent(type, Instant.now(), checkerId, backendUrl, null, null, null);
    }

    public static CheckerEvent of(CheckerEventType type,
                                  String checkerId,
                                  String backendUrl,
                                  String frontendKey,
                                  Integer position) {
        return new CheckerEvent(type, Instant.now(), checkerId, backendUrl, frontendKey, position, null);
    }

    /**
     * Copy of this event carrying a free-form detail (error message, channel name).
     */
    public CheckerEvent withDetail(String detail) {
        return new CheckerEvent(type, timestamp, checkerId, backendUrl, frontendKey, position, detail);
    }
}
