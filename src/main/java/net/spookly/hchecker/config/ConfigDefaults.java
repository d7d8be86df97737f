package net.spookly.hchecker.config;

/**
 * Default configuration template written when no config file exists, plus the
 * fallback values applied when optional settings are omitted.
 */
public final class ConfigDefaults {
    public static final String REDIS_ADDRESS = "localhost:6379";
    public static final int REDIS_MAX_IDLE = 3;
    public static final int REDIS_MAX_TOTAL = 16;
    public static final int REDIS_IDLE_TIMEOUT_SECONDS = 120;
    public static final int REDIS_TIMEOUT_MS = 2000;
    public static final int HEARTBEAT_INTERVAL_SECONDS = 5;
    public static final int CHECK_INTERVAL_SECONDS = 3;
    public static final int PROBE_TIMEOUT_MS = 2000;
    public static final String EVICTION_CHANNEL = "dead";
    public static final int RECONNECT_BACKOFF_SECONDS = 10;

    private static final String DEFAULT_YAML = """
            # Generated default hchecker config.
            redis:
              address: localhost:6379
              # password: env:HCHECKER_REDIS_PASSWORD
              maxIdle: 3
              maxTotal: 16
              idleTimeoutSeconds: 120
              timeoutMs: 2000

            checker:
              heartbeatIntervalSeconds: 5
              checkIntervalSeconds: 3
              probeTimeoutMs: 2000

            eviction:
              enabled: true
              channel: dead
              reconnectBackoffSeconds: 10

            observability:
              logging:
                auditEvents: true
            """;

    private ConfigDefaults() {
    }

    /**
     * Render the default configuration template.
     */
    public static String defaultYaml() {
        return DEFAULT_YAML;
    }

    public static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }
}
