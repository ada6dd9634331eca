package de.bsommerfeld.pseat.db;

import com.google.inject.AbstractModule;
import com.google.inject.name.Names;
import de.bsommerfeld.pseat.core.config.ApplicationMode;
import de.bsommerfeld.pseat.core.config.ConfigLoader;
import de.bsommerfeld.pseat.core.config.DatabaseConfig;
import de.bsommerfeld.pseat.core.config.DefaultsConfig;
import de.bsommerfeld.pseat.core.config.GlobalConfig;
import de.bsommerfeld.pseat.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice module wiring the rules store. Loads {@code config.toml}, binds the
 * configuration sections and selects the {@link DatabaseService}
 * implementation for the current {@link ApplicationMode}.
 *
 * <pre>
 * Injector injector = Guice.createInjector(new RulesModule());
 * RulesRepository rules = injector.getInstance(RulesRepository.class);
 * </pre>
 */
public class RulesModule extends AbstractModule {

    /** Binding name of the directory relative database paths resolve against. */
    public static final String DATA_DIR = "pseat.data-dir";

    private static final Logger LOG = LoggerFactory.getLogger(RulesModule.class);

    private final Path dataDir;
    private final ApplicationMode mode;

    /** Uses the platform app data directory and the mode from the environment. */
    public RulesModule() {
        this(StorageUtils.getAppDataDir(StorageUtils.APP_NAME), ApplicationMode.get());
    }

    public RulesModule(Path dataDir, ApplicationMode mode) {
        this.dataDir = dataDir.toAbsolutePath();
        this.mode = mode;
    }

    @Override
    protected void configure() {
        Path configPath = StorageUtils.getConfigFile(dataDir);
        LOG.info("Loading Configuration from: {}", configPath);
        GlobalConfig config = ConfigLoader.from(configPath).load();

        bind(GlobalConfig.class).toInstance(config);
        bind(DatabaseConfig.class).toInstance(config.getDatabase());
        bind(DefaultsConfig.class).toInstance(config.getDefaults());
        bind(Path.class).annotatedWith(Names.named(DATA_DIR)).toInstance(dataDir);

        LOG.info("Application Mode initialized: {}", mode);
        if (mode.isTest()) {
            bind(DatabaseService.class).to(TestDatabaseService.class);
        } else {
            bind(DatabaseService.class).to(SqlDatabaseService.class);
        }
    }
}
