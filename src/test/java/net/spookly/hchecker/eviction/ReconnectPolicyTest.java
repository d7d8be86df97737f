package net.spookly.hchecker.eviction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import net.spookly.hchecker.config.HcheckerConfig;
import org.junit.jupiter.api.Test;

class ReconnectPolicyTest {
    @Test
    void defaultsToTenSecondsWithoutLimit() {
        ReconnectPolicy policy = ReconnectPolicy.fromConfig(new HcheckerConfig());

        assertEquals(Duration.ofSeconds(10), policy.backoff());
        assertNull(policy.maxAttempts());
        assertTrue(policy.allowsRetry(Integer.MAX_VALUE));
    }

    @Test
    void honoursConfiguredLimit() {
        HcheckerConfig config = new HcheckerConfig();
        config.eviction = new HcheckerConfig.EvictionConfig();
        config.eviction.reconnectBackoffSeconds = 2;
        config.eviction.maxReconnectAttempts = 2;

        ReconnectPolicy policy = ReconnectPolicy.fromConfig(config);

        assertEquals(Duration.ofSeconds(2), policy.backoff());
        assertTrue(policy.allowsRetry(1));
        assertFalse(policy.allowsRetry(2));
    }

    @Test
    void rejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> new ReconnectPolicy(Duration.ofSeconds(1), 0));
    }
}
