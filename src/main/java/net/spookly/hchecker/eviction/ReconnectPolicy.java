package net.spookly.hchecker.eviction;

import java.time.Duration;
import java.util.Objects;

import net.spookly.hchecker.config.ConfigDefaults;
import net.spookly.hchecker.config.HcheckerConfig;

/**
 * Fixed-backoff restart policy for the eviction subscription.
 *
 * @param backoff     wait between losing the subscription and resubscribing
 * @param maxAttempts consecutive failed attempts tolerated before giving up, or null for no limit
 */
public record ReconnectPolicy(Duration backoff, Integer maxAttempts) {
    public ReconnectPolicy {
        Objects.requireNonNull(backoff, "backoff");
        if (backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative");
        }
        if (maxAttempts != null && maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be greater than 0");
        }
    }

    /**
     * Retry forever with a fixed backoff.
     */
    public static ReconnectPolicy fixed(Duration backoff) {
        return new ReconnectPolicy(backoff, null);
    }

    public static ReconnectPolicy fromConfig(HcheckerConfig config) {
        HcheckerConfig.EvictionConfig eviction = config.eviction;
        if (eviction == null) {
            return fixed(Duration.ofSeconds(ConfigDefaults.RECONNECT_BACKOFF_SECONDS));
        }
        int backoffSeconds = ConfigDefaults.orDefault(eviction.reconnectBackoffSeconds,
                ConfigDefaults.RECONNECT_BACKOFF_SECONDS);
        return new ReconnectPolicy(Duration.ofSeconds(backoffSeconds), eviction.maxReconnectAttempts);
    }

    /**
     * True when another attempt is allowed after {@code failures} consecutive failures.
     */
    public boolean allowsRetry(int failures) {
        return maxAttempts == null || failures < maxAttempts;
    }
}
