package de.bsommerfeld.dashboard.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves where the dashboard keeps its configuration and logs, following
 * each platform's conventions. Paths are absolute but <strong>not</strong>
 * created; callers create what they write to.
 *
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_CONFIG_HOME/{appName}} (fallback
 * {@code ~/.config})</li>
 * </ul>
 */
public final class AppDirectories {

    public static final String APP_NAME = "ops-dashboard";

    private AppDirectories() {
    }

    /**
     * @param appName directory name for the application
     * @return absolute platform-specific base directory
     */
    public static Path baseDir(String appName) {
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
            return Paths.get(xdgConfig, appName).toAbsolutePath();
        }
        return Paths.get(System.getProperty("user.home"), ".config", appName);
    }

    /** {@code {baseDir}/config.toml} */
    public static Path configFile(String appName) {
        return baseDir(appName).resolve("config.toml");
    }

    /** {@code {baseDir}/logs} */
    public static Path logsDir(String appName) {
        return baseDir(appName).resolve("logs");
    }
}
