package net.spookly.hchecker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import net.spookly.hchecker.config.HcheckerConfig;
import org.junit.jupiter.api.Test;

class CheckerIdentityTest {
    @Test
    void prefersConfiguredId() {
        HcheckerConfig config = new HcheckerConfig();
        config.checker = new HcheckerConfig.CheckerConfig();
        config.checker.id = " checker-a ";

        assertEquals("checker-a", CheckerIdentity.resolve(config));
    }

    @Test
    void derivesIdFromHostAndPid() {
        String id = CheckerIdentity.resolve(new HcheckerConfig());

        assertTrue(id.endsWith("-" + ProcessHandle.current().pid()));
    }
}
