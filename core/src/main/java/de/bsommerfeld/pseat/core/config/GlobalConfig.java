package de.bsommerfeld.pseat.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Unknown keys are ignored so that older
 * binaries can read files written by newer ones.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalConfig {

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    @JsonProperty("defaults")
    private DefaultsConfig defaults = new DefaultsConfig();

    public DatabaseConfig getDatabase() {
        return database;
    }

    public DefaultsConfig getDefaults() {
        return defaults;
    }
}
