package net.spookly.hchecker.event;

/**
 * Audit event types emitted by the checker core.
 */
public enum CheckerEventType {
    LOCK_ACQUIRED,
    LOCK_JOINED,
    LOCK_HELD_ELSEWHERE,
    LOCK_RELEASED,
    MAPPING_DROPPED,
    BACKEND_DEAD,
    BACKEND_ALIVE,
    STORE_WRITE_FAILED,
    SUBSCRIPTION_LOST,
    SUBSCRIPTION_RESTORED,
    EVICTION_RECEIVED
}
