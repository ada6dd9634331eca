package de.bsommerfeld.pseat.db;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.pseat.core.config.ApplicationMode;
import de.bsommerfeld.pseat.core.config.DefaultsConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RulesModuleTest {

    @TempDir
    Path tempDir;

    @Test
    void testMode_shouldBindInMemoryStore() {
        Injector injector = Guice.createInjector(new RulesModule(tempDir, ApplicationMode.TEST));

        assertInstanceOf(TestDatabaseService.class, injector.getInstance(DatabaseService.class));
        assertFalse(Files.exists(tempDir.resolve("pseat-rules.db")));
    }

    @Test
    void prodMode_shouldOpenSqliteFileInDataDir() {
        Injector injector = Guice.createInjector(new RulesModule(tempDir, ApplicationMode.PROD));

        DatabaseService db = injector.getInstance(DatabaseService.class);

        assertInstanceOf(SqlDatabaseService.class, db);
        assertTrue(Files.isRegularFile(tempDir.resolve("pseat-rules.db")));
        assertTrue(Files.isRegularFile(tempDir.resolve("config.toml")));
    }

    @Test
    void module_shouldShareSingletonsAndLoadDefaults() throws Exception {
        Files.writeString(tempDir.resolve("config.toml"), "[defaults]\nmax-offenses = 7\n");
        Injector injector = Guice.createInjector(new RulesModule(tempDir, ApplicationMode.TEST));

        RulesRepository repository = injector.getInstance(RulesRepository.class);
        try {
            assertSame(repository, injector.getInstance(RulesRepository.class));
            assertEquals(7, injector.getInstance(DefaultsConfig.class).getMaxOffenses());
            assertEquals(7, repository.getConfigOrDefault(1, 1).maxOffenses());
        } finally {
            repository.shutdown();
        }
    }
}
