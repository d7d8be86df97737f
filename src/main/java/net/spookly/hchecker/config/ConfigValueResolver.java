package net.spookly.hchecker.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Resolves indirect values in the raw YAML tree before binding.
 *
 * <p>{@code env:NAME} is accepted for any scalar. {@code path:file} reads a secret from disk and is
 * only accepted for the keys in {@link #FILE_BACKED_KEYS}; relative files resolve against the
 * directory holding the config file.
 */
final class ConfigValueResolver {
    static final Set<String> FILE_BACKED_KEYS = Set.of("redis.password");

    private static final String ENV_PREFIX = "env:";
    private static final String PATH_PREFIX = "path:";

    private ConfigValueResolver() {
    }

    static Map<String, Object> resolve(Map<?, ?> root, Path configDir) {
        return resolveSection(root, "", configDir);
    }

    private static Map<String, Object> resolveSection(Map<?, ?> section, String prefix, Path configDir) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : section.entrySet()) {
            String key = String.valueOf(entry.getKey());
            String name = prefix.isEmpty() ? key : prefix + "." + key;
            resolved.put(key, resolveValue(name, entry.getValue(), configDir));
        }
        return resolved;
    }

    private static Object resolveValue(String name, Object value, Path configDir) {
        if (value instanceof Map) {
            return resolveSection((Map<?, ?>) value, name, configDir);
        }
        if (!(value instanceof String)) {
            return value;
        }
        String raw = (String) value;
        if (raw.startsWith(ENV_PREFIX)) {
            return fromEnvironment(name, raw.substring(ENV_PREFIX.length()));
        }
        if (raw.startsWith(PATH_PREFIX)) {
            if (!FILE_BACKED_KEYS.contains(name)) {
                throw new ConfigException(name + " does not accept path: values, only " + FILE_BACKED_KEYS + " do");
            }
            return fromFile(name, raw.substring(PATH_PREFIX.length()), configDir);
        }
        return raw;
    }

    private static String fromEnvironment(String name, String variable) {
        String value = System.getenv(variable);
        if (value == null) {
            throw new ConfigException(name + " refers to unset environment variable " + variable);
        }
        return value;
    }

    private static String fromFile(String name, String location, Path configDir) {
        if (location.isBlank()) {
            throw new ConfigException(name + " has an empty path: value");
        }
        Path file;
        try {
            file = Path.of(location);
        } catch (InvalidPathException e) {
            throw new ConfigException(name + " has an invalid path: " + location, e);
        }
        if (!file.isAbsolute() && configDir != null) {
            file = configDir.resolve(file).normalize();
        }
        String secret;
        try {
            secret = Files.readString(file, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new ConfigException("Failed to read " + name + " from " + file, e);
        }
        if (secret.isEmpty()) {
            throw new ConfigException(name + " file is empty: " + file);
        }
        return secret;
    }
}
