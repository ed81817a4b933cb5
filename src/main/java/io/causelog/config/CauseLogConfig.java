package io.causelog.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class CauseLogConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DB_FILE_NAME = "causelog.db";
    public static final String SETTINGS_FILE_NAME = "causelog-settings.json";

    private final Path rootDir;
    private final StoreSettings settings;

    public CauseLogConfig(Path rootDir, StoreSettings settings) {
        this.rootDir = rootDir;
        this.settings = settings == null ? StoreSettings.defaults() : settings;
    }

    /**
     * Resolves the root directory and reads {@code causelog-settings.json} from it when present.
     */
    public static CauseLogConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        return new CauseLogConfig(base, StoreSettings.load(base.resolve(SETTINGS_FILE_NAME)));
    }

    public CauseLogConfig withSettings(StoreSettings settings) {
        return new CauseLogConfig(rootDir, settings);
    }

    public Path rootDir() {
        return rootDir;
    }

    public StoreSettings settings() {
        return settings;
    }

    public Path dbFile() {
        return rootDir.resolve(DB_FILE_NAME);
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }
}
