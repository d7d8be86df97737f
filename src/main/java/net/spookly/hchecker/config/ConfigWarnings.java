package net.spookly.hchecker.config;

import java.util.ArrayList;
import java.util.List;

import net.spookly.hchecker.util.StoreAddress;

/**
 * Collects non-fatal configuration warnings (for example, an unauthenticated remote store).
 */
public final class ConfigWarnings {
    private ConfigWarnings() {
    }

    public static List<String> collect(HcheckerConfig config) {
        List<String> warnings = new ArrayList<>();
        if (config == null) {
            return warnings;
        }
        HcheckerConfig.RedisConfig redis = config.redis;
        String address = redis == null || redis.address == null ? ConfigDefaults.REDIS_ADDRESS : redis.address;
        String password = redis == null ? null : redis.password;
        if (isBlank(password) && !StoreAddress.parse(address).isLoopback()) {
            warnings.add("redis.password is not set for non-loopback store " + address);
        }
        if (config.checker == null || isBlank(config.checker.id)) {
            warnings.add("checker.id is not set, deriving identity from host name and pid");
        }
        return warnings;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
