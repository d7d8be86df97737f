package net.spookly.hchecker.store;

/**
 * Raised when the coordination store cannot be reached or rejects a required command.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
