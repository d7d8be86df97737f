package net.spookly.hchecker.config;

/**
 * Raised when the checker configuration cannot be read or is invalid.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
