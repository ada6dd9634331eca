package de.bsommerfeld.pseat.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Running mode of the rules store. {@link #TEST} swaps the SQLite store for
 * an in-memory one, so nothing is written to disk.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    public static final String PROPERTY = "app.mode";
    public static final String ENV_VARIABLE = "APP_MODE";

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Mode of the current process: the {@value #PROPERTY} system property wins
     * over the {@value #ENV_VARIABLE} environment variable.
     */
    public static ApplicationMode get() {
        return resolve(System.getProperty(PROPERTY), System.getenv(ENV_VARIABLE));
    }

    static ApplicationMode resolve(String property, String environment) {
        String raw = isBlank(property) ? environment : property;
        if (isBlank(raw))
            return PROD;

        for (ApplicationMode mode : values()) {
            if (mode.name().equals(raw.trim().toUpperCase(Locale.ROOT)))
                return mode;
        }
        LOG.warn("Unknown Application Mode '{}'. Defaulting to PROD.", raw);
        return PROD;
    }

    public boolean isTest() {
        return this == TEST;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
