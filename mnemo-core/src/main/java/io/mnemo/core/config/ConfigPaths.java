package io.mnemo.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        String override = System.getenv("MNEMO_CONFIG");
        if (override != null && !override.isBlank()) {
            return expandHome(override.trim());
        }
        return Path.of(System.getProperty("user.home"), ".mnemo", "config.json");
    }

    public static Path expandHome(String rawPath) {
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
