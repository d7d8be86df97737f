package net.spookly.hchecker.check;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class CheckTest {
    @Test
    void carriesTokenOnlyAfterLock() {
        Check check = new Check("http://10.0.0.1:80", "www.example.com", 0);
        assertNull(check.ownershipToken());

        check.attachOwnershipToken("p1;1700000000.1");

        assertEquals("p1;1700000000.1", check.ownershipToken());
    }

    @Test
    void rejectsNegativePosition() {
        assertThrows(IllegalArgumentException.class, () -> new Check("http://10.0.0.1:80", "www.example.com", -1));
    }
}
