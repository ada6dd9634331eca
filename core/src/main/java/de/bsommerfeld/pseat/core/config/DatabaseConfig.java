package de.bsommerfeld.pseat.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Location and locking behavior of the SQLite store.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatabaseConfig {

    @JsonProperty("file")
    private String file = "pseat-rules.db";

    @JsonProperty("busy-timeout-ms")
    private int busyTimeoutMillis = 5000;

    public String getFile() {
        return file;
    }

    public void setFile(String file) {
        this.file = file;
    }

    public int getBusyTimeoutMillis() {
        return busyTimeoutMillis;
    }

    public void setBusyTimeoutMillis(int busyTimeoutMillis) {
        this.busyTimeoutMillis = busyTimeoutMillis;
    }

    /**
     * Resolves {@link #getFile()} against {@code baseDir} unless it is
     * already absolute.
     */
    public Path resolveFile(Path baseDir) {
        Path path = Paths.get(file);
        return path.isAbsolute() ? path : baseDir.resolve(path).toAbsolutePath();
    }
}
