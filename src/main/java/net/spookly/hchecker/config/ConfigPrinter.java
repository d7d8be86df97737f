package net.spookly.hchecker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.Yaml;

import java.util.Map;

/**
 * Renders the effective configuration with sensitive values redacted.
 */
public final class ConfigPrinter {
    private static final String REDACTED = "<redacted>";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigPrinter() {
    }

    public static String toYaml(HcheckerConfig config) {
        Map<String, Object> data = MAPPER.convertValue(config, Map.class);
        redactSensitiveValues(data);
        Yaml yaml = new Yaml();
        return yaml.dump(data);
    }

    @SuppressWarnings("unchecked")
    private static void redactSensitiveValues(Map<String, Object> data) {
        if (data == null) {
            return;
        }
        Object redis = data.get("redis");
        if (redis instanceof Map) {
            Map<String, Object> redisMap = (Map<String, Object>) redis;
            if (redisMap.get("password") != null) {
                redisMap.put("password", REDACTED);
            }
        }
    }
}
