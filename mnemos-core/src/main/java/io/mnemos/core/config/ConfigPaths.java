package io.mnemos.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path home() {
        return Path.of(System.getProperty("user.home"), ".mnemos");
    }

    public static Path defaultConfigPath() {
        return home().resolve("config.json");
    }

    public static Path resolve(String rawPath, Path fallback) {
        if (rawPath == null || rawPath.isBlank()) {
            return fallback;
        }
        return Path.of(expandHome(rawPath));
    }

    public static String expandHome(String rawPath) {
        if (rawPath != null && rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2)).toString();
        }
        return rawPath;
    }
}
