package de.bsommerfeld.pseat.core.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StorageUtilsTest {

    private static final String HOME = Paths.get("/home/mod").toAbsolutePath().toString();

    @Test
    void getAppDataDir_shouldBeAbsoluteAndNamedAfterApp() {
        Path dir = StorageUtils.getAppDataDir("test-app");

        assertTrue(dir.isAbsolute());
        assertEquals("test-app", dir.getFileName().toString());
    }

    @Test
    void resolveAppDataDir_shouldUseApplicationSupportOnMac() {
        Path dir = StorageUtils.resolveAppDataDir("app", "Mac OS X", HOME, name -> null);

        assertEquals(Paths.get(HOME, "Library", "Application Support", "app"), dir);
    }

    @Test
    void resolveAppDataDir_shouldPreferAppDataOnWindows() {
        String appData = Paths.get("/roaming").toAbsolutePath().toString();
        Map<String, String> env = Map.of("APPDATA", appData);

        Path dir = StorageUtils.resolveAppDataDir("app", "Windows 11", HOME, env::get);

        assertEquals(Paths.get(appData, "app"), dir);
    }

    @Test
    void resolveAppDataDir_shouldFallBackToRoamingOnWindows() {
        Path dir = StorageUtils.resolveAppDataDir("app", "Windows 11", HOME, name -> null);

        assertEquals(Paths.get(HOME, "AppData", "Roaming", "app"), dir);
    }

    @Test
    void resolveAppDataDir_shouldHonourXdgDataHomeOnLinux() {
        String xdg = Paths.get("/xdg").toAbsolutePath().toString();
        Map<String, String> env = Map.of("XDG_DATA_HOME", xdg);

        assertEquals(Paths.get(xdg, "app"), StorageUtils.resolveAppDataDir("app", "Linux", HOME, env::get));
    }

    @Test
    void resolveAppDataDir_shouldIgnoreBlankXdgDataHome() {
        Map<String, String> env = Map.of("XDG_DATA_HOME", "");

        assertEquals(Paths.get(HOME, ".local", "share", "app"),
                StorageUtils.resolveAppDataDir("app", "Linux", HOME, env::get));
    }

    @Test
    void getConfigFile_shouldLiveInDataDir() {
        Path dataDir = Paths.get(HOME, "data");

        assertEquals(dataDir.resolve("config.toml"), StorageUtils.getConfigFile(dataDir));
    }
}
