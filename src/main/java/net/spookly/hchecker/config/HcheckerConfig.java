package net.spookly.hchecker.config;

public class HcheckerConfig {
    public RedisConfig redis;
    public CheckerConfig checker;
    public EvictionConfig eviction;
    public ObservabilityConfig observability;

    public static class RedisConfig {
        /**
         * Store address as host:port.
         */
        public String address;
        public String password;
        public Integer maxIdle;
        public Integer maxTotal;
        public Integer idleTimeoutSeconds;
        public Integer timeoutMs;
    }

    public static class CheckerConfig {
        /**
         * Identity used in ownership tokens and sync markers. Derived from the host when blank.
         */
        public String id;
        public Integer heartbeatIntervalSeconds;
        public Integer checkIntervalSeconds;
        public Integer probeTimeoutMs;
    }

    public static class EvictionConfig {
        public Boolean enabled;
        public String channel;
        public Integer reconnectBackoffSeconds;
        public Integer maxReconnectAttempts;
    }

    public static class ObservabilityConfig {
        public LoggingConfig logging;
    }

    public static class LoggingConfig {
        public Boolean auditEvents;
    }
}
