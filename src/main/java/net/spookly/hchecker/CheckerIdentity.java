package net.spookly.hchecker;

import java.net.InetAddress;
import java.net.UnknownHostException;

import net.spookly.hchecker.config.HcheckerConfig;

/**
 * Resolves the identity written into ownership tokens and sync markers.
 */
public final class CheckerIdentity {
    private CheckerIdentity() {
    }

    /**
     * The configured {@code checker.id}, or {@code <hostname>-<pid>} when it is blank.
     */
    public static String resolve(HcheckerConfig config) {
        if (config.checker != null && config.checker.id != null && !config.checker.id.isBlank()) {
            return config.checker.id.trim();
        }
        return hostName() + "-" + ProcessHandle.current().pid();
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }
}
