package net.spookly.hchecker.eviction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.spookly.hchecker.check.Check;
import org.junit.jupiter.api.Test;

class EvictionNoticeTest {
    @Test
    void parsesProxyNotification() {
        EvictionNotice notice = EvictionNotice.parse("localhost;http://localhost:4242;0;1");

        assertEquals("localhost", notice.frontendKey());
        assertEquals("http://localhost:4242", notice.backendUrl());
        assertEquals(0, notice.backendPosition());
        assertEquals(1, notice.totalBackends());
    }

    @Test
    void convertsToCheck() {
        Check check = EvictionNotice.parse("www.example.com;http://10.0.0.1:80;2;3").toCheck();

        assertEquals("http://10.0.0.1:80", check.backendUrl());
        assertEquals("www.example.com", check.frontendKey());
        assertEquals(2, check.backendPosition());
    }

    @Test
    void rejectsMalformedLines() {
        assertThrows(IllegalArgumentException.class, () -> EvictionNotice.parse("www.example.com;http://10.0.0.1:80;0"));
        assertThrows(IllegalArgumentException.class, () -> EvictionNotice.parse("www.example.com;http://10.0.0.1:80;x;1"));
        assertThrows(IllegalArgumentException.class, () -> EvictionNotice.parse(";http://10.0.0.1:80;0;1"));
        assertThrows(IllegalArgumentException.class, () -> EvictionNotice.parse("www.example.com;http://10.0.0.1:80;-1;1"));
    }
}
