package net.spookly.hchecker.store;

/**
 * Result of the atomic test-and-set on a backend lock record.
 *
 * @param placeholderSet true when the lock record was absent and the placeholder got written
 * @param markerPresent  true when this checker's sync marker for the backend already exists
 */
public record LockAttempt(boolean placeholderSet, boolean markerPresent) {
}
