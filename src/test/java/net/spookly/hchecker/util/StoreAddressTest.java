package net.spookly.hchecker.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StoreAddressTest {
    @Test
    void parsesHostAndPort() {
        StoreAddress address = StoreAddress.parse("127.0.0.1:6379");
        assertEquals("127.0.0.1", address.host());
        assertEquals(6379, address.port());
        assertTrue(address.isLoopback());
    }

    @Test
    void detectsRemoteHost() {
        assertFalse(StoreAddress.parse("redis.internal:6379").isLoopback());
    }

    @Test
    void rejectsInvalidFormat() {
        assertThrows(IllegalArgumentException.class, () -> StoreAddress.parse("bad"));
        assertThrows(IllegalArgumentException.class, () -> StoreAddress.parse("localhost:70000"));
    }
}
