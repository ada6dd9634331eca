package de.bsommerfeld.pseat.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Locates the rules store's files on disk. Nothing here creates directories.
 *
 * <p>
 * The data directory follows each platform's convention:
 * <ul>
 * <li><strong>macOS</strong>:
 * {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}}, else
 * {@code ~/AppData/Roaming/{appName}}</li>
 * <li><strong>Linux</strong> and others: {@code $XDG_DATA_HOME/{appName}},
 * else {@code ~/.local/share/{appName}}</li>
 * </ul>
 */
public final class StorageUtils {

    public static final String APP_NAME = "pseat-rules";
    public static final String CONFIG_FILE_NAME = "config.toml";

    private StorageUtils() {
    }

    /** Absolute data directory for {@code appName} on the running platform. */
    public static Path getAppDataDir(String appName) {
        return resolveAppDataDir(appName,
                System.getProperty("os.name", "generic"),
                System.getProperty("user.home"),
                System::getenv);
    }

    /** {@code config.toml} inside the given data directory. */
    public static Path getConfigFile(Path dataDir) {
        return dataDir.resolve(CONFIG_FILE_NAME);
    }

    static Path resolveAppDataDir(String appName, String osName, String userHome, UnaryOperator<String> env) {
        String os = osName.toLowerCase(Locale.ENGLISH);
        Path base;
        if (os.contains("mac") || os.contains("darwin")) {
            base = Paths.get(userHome, "Library", "Application Support");
        } else if (os.contains("win")) {
            base = orElse(env.apply("APPDATA"), Paths.get(userHome, "AppData", "Roaming"));
        } else {
            base = orElse(env.apply("XDG_DATA_HOME"), Paths.get(userHome, ".local", "share"));
        }
        return base.resolve(appName).toAbsolutePath();
    }

    private static Path orElse(String configured, Path fallback) {
        return configured == null || configured.isEmpty() ? fallback : Paths.get(configured);
    }
}
