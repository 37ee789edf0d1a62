package io.jerry.core.config;

import java.nio.file.Path;
import java.util.Map;

public final class ConfigPaths {
    public static final String CONFIG_ENV = "JERRY_CONFIG";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return defaultConfigPath(System.getenv());
    }

    public static Path defaultConfigPath(Map<String, String> env) {
        String override = env.get(CONFIG_ENV);
        if (override != null && !override.isBlank()) {
            return expandHome(override);
        }
        return Path.of(System.getProperty("user.home"), ".jerry", "config.json");
    }

    static Path expandHome(String rawPath) {
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
