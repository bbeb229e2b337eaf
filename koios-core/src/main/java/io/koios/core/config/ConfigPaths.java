package io.koios.core.config;

import java.nio.file.Path;

/**
 * Filesystem locations under {@code ~/.koios}. Configured paths may start with {@code ~/}.
 */
public final class ConfigPaths {
    private static final String HOME_DIR = ".koios";

    private ConfigPaths() {
    }

    public static Path homeDirectory() {
        return userHome().resolve(HOME_DIR);
    }

    public static Path defaultConfigPath() {
        return homeDirectory().resolve("config.json");
    }

    public static Path defaultDataDirectory() {
        return homeDirectory().resolve("data");
    }

    public static Path resolve(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return defaultDataDirectory();
        }
        String trimmed = rawPath.trim();
        if (trimmed.equals("~")) {
            return userHome();
        }
        if (trimmed.startsWith("~/")) {
            return userHome().resolve(trimmed.substring(2));
        }
        return Path.of(trimmed);
    }

    private static Path userHome() {
        return Path.of(System.getProperty("user.home"));
    }
}
