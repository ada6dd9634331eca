package de.bsommerfeld.pseat.core.config;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link GlobalConfig} from a TOML file. A missing file is created with
 * the built-in defaults so that operators have something to edit.
 *
 * <pre>
 * GlobalConfig config = ConfigLoader.from(path).load();
 * </pre>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final TomlMapper MAPPER = new TomlMapper();

    private final Path path;

    private ConfigLoader(Path path) {
        this.path = path;
    }

    public static ConfigLoader from(Path path) {
        return new ConfigLoader(path);
    }

    /**
     * Loads the file, writing defaults first if it does not exist.
     *
     * @throws UncheckedIOException if the file cannot be read, parsed or
     *                              created
     */
    public GlobalConfig load() {
        try {
            if (Files.notExists(path)) {
                GlobalConfig defaults = new GlobalConfig();
                save(defaults);
                LOG.info("No configuration found, wrote defaults to {}", path);
                return defaults;
            }
            GlobalConfig config = MAPPER.readValue(path.toFile(), GlobalConfig.class);
            LOG.debug("Configuration loaded from {}", path);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load configuration from " + path, e);
        }
    }

    /** Writes {@code config} to the loader's path, creating parent directories. */
    public void save(GlobalConfig config) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), config);
    }
}
