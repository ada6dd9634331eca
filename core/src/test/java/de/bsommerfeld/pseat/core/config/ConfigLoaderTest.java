package de.bsommerfeld.pseat.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldWriteDefaultsWhenFileIsMissing() {
        Path file = tempDir.resolve("nested").resolve("config.toml");

        GlobalConfig config = ConfigLoader.from(file).load();

        assertTrue(Files.exists(file));
        assertEquals(3L, config.getDefaults().getMaxOffenses());
        assertEquals("pseat-rules.db", config.getDatabase().getFile());
    }

    @Test
    void load_shouldReadValuesFromToml() throws Exception {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, String.join("\n",
                "[database]",
                "file = \"custom.db\"",
                "busy-timeout-ms = 250",
                "",
                "[defaults]",
                "max-offenses = 7",
                "event-cooldown = 2.5",
                "prefixes = \"3pseat, 3pfeet\"",
                ""), StandardCharsets.UTF_8);

        GlobalConfig config = ConfigLoader.from(file).load();

        assertEquals("custom.db", config.getDatabase().getFile());
        assertEquals(250, config.getDatabase().getBusyTimeoutMillis());
        assertEquals(7L, config.getDefaults().getMaxOffenses());
        assertEquals(2.5, config.getDefaults().getEventCooldown(), 0.0001);
        assertEquals("3pseat, 3pfeet", config.getDefaults().getPrefixes());
        // Untouched keys keep their defaults
        assertEquals(300L, config.getDefaults().getTimeoutDuration());
    }

    @Test
    void load_shouldIgnoreUnknownKeys() throws Exception {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, "unknown-key = 1\n[database]\nfile = \"x.db\"\nlegacy = true\n",
                StandardCharsets.UTF_8);

        GlobalConfig config = ConfigLoader.from(file).load();

        assertEquals("x.db", config.getDatabase().getFile());
    }

    @Test
    void load_shouldRoundTripSavedConfig() throws Exception {
        Path file = tempDir.resolve("config.toml");
        GlobalConfig original = new GlobalConfig();
        original.getDatabase().setBusyTimeoutMillis(1234);
        original.getDefaults().setPrefixes("!");
        ConfigLoader.from(file).save(original);

        GlobalConfig loaded = ConfigLoader.from(file).load();

        assertEquals(1234, loaded.getDatabase().getBusyTimeoutMillis());
        assertEquals("!", loaded.getDefaults().getPrefixes());
    }

    @Test
    void load_shouldFailOnMalformedToml() throws Exception {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, "[database\nfile = ", StandardCharsets.UTF_8);

        assertThrows(UncheckedIOException.class, () -> ConfigLoader.from(file).load());
    }
}
