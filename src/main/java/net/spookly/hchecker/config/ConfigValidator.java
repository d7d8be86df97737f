package net.spookly.hchecker.config;

import java.util.ArrayList;
import java.util.List;

import net.spookly.hchecker.util.StoreAddress;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(HcheckerConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateRedis(config, errors);
        validateChecker(config, errors);
        validateEviction(config, errors);

        throwIfErrors(errors);
    }

    private static void validateRedis(HcheckerConfig config, List<String> errors) {
        HcheckerConfig.RedisConfig redis = config.redis;
        if (redis == null) {
            return;
        }
        if (redis.address != null) {
            try {
                StoreAddress.parse(redis.address);
            } catch (IllegalArgumentException e) {
                errors.add("redis.address is invalid: " + e.getMessage());
            }
        }
        if (redis.maxIdle != null && redis.maxIdle < 0) {
            errors.add("redis.maxIdle must not be negative");
        }
        requirePositive(errors, redis.maxTotal, "redis.maxTotal");
        requirePositive(errors, redis.idleTimeoutSeconds, "redis.idleTimeoutSeconds");
        requirePositive(errors, redis.timeoutMs, "redis.timeoutMs");
        if (redis.maxIdle != null && redis.maxTotal != null && redis.maxIdle > redis.maxTotal) {
            errors.add("redis.maxIdle must not exceed redis.maxTotal");
        }
    }

    private static void validateChecker(HcheckerConfig config, List<String> errors) {
        HcheckerConfig.CheckerConfig checker = config.checker;
        if (checker == null) {
            return;
        }
        if (checker.id != null && checker.id.contains(";")) {
            errors.add("checker.id must not contain ';'");
        }
        requirePositive(errors, checker.heartbeatIntervalSeconds, "checker.heartbeatIntervalSeconds");
        requirePositive(errors, checker.checkIntervalSeconds, "checker.checkIntervalSeconds");
        requirePositive(errors, checker.probeTimeoutMs, "checker.probeTimeoutMs");
    }

    private static void validateEviction(HcheckerConfig config, List<String> errors) {
        HcheckerConfig.EvictionConfig eviction = config.eviction;
        if (eviction == null) {
            return;
        }
        if (eviction.channel != null && isBlank(eviction.channel)) {
            errors.add("eviction.channel must not be blank");
        }
        requirePositive(errors, eviction.reconnectBackoffSeconds, "eviction.reconnectBackoffSeconds");
        requirePositive(errors, eviction.maxReconnectAttempts, "eviction.maxReconnectAttempts");
    }

    private static void requirePositive(List<String> errors, Integer value, String field) {
        if (value != null && value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
