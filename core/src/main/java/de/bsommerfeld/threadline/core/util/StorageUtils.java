package de.bsommerfeld.threadline.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves OS-specific application data directories following each platform's
 * native conventions. Paths are absolute but <strong>not</strong> created.
 *
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_CONFIG_HOME/{appName}} (fallback:
 * {@code ~/.config})</li>
 * </ul>
 */
public final class StorageUtils {

    private StorageUtils() {
    }

    public static Path getConfigDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(System.getProperty("user.home"), "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return appData != null
                    ? Paths.get(appData, appName)
                    : Paths.get(System.getProperty("user.home"), "AppData", "Roaming", appName);
        }
        String xdgConfig = System.getenv("XDG_CONFIG_HOME");
        if (xdgConfig != null && !xdgConfig.isEmpty()) {
            return Paths.get(xdgConfig, appName);
        }
        return Paths.get(System.getProperty("user.home"), ".config", appName);
    }

    /** Default location of {@code threadline.toml}. */
    public static Path defaultConfigFile() {
        return getConfigDir("threadline").resolve("threadline.toml");
    }
}
