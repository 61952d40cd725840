package sh.harold.tidybox.core.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TidyboxConfigLoaderTest {
    private static final System.Logger LOGGER = System.getLogger("config-test");

    @Test
    void loadOrCreate_missingFile_writesDefaults(@TempDir Path tempDir) {
        Path configPath = TidyboxConfigLoader.defaultPath(tempDir);

        TidyboxConfig created = TidyboxConfigLoader.loadOrCreate(configPath, tempDir, LOGGER);

        assertEquals(TidyboxConfig.defaults(tempDir), created);
        assertTrue(Files.exists(configPath));
        assertEquals(created, TidyboxConfigLoader.loadOrCreate(configPath, tempDir, LOGGER));
    }

    @Test
    void parse_readsValuesAndExpandsHome(@TempDir Path tempDir) {
        Path home = tempDir.resolve("someone");
        Properties raw = new Properties();
        raw.setProperty(TidyboxConfigLoader.KEY_HOME, home.toString());
        raw.setProperty(TidyboxConfigLoader.KEY_SCAN_THREADS, " 3 ");
        raw.setProperty(TidyboxConfigLoader.KEY_INCLUDE_ROOT_ONLY, "true");
        raw.setProperty(TidyboxConfigLoader.KEY_APPS_DIRS, "~/Apps, /opt/apps ,");
        raw.setProperty(TidyboxConfigLoader.KEY_KNOWN_IDENTIFIERS, "~/state/ids.txt");

        TidyboxConfig config = TidyboxConfigLoader.parse(raw, tempDir, LOGGER);

        assertEquals(home, config.home());
        assertEquals(3, config.scanThreads());
        assertTrue(config.includeRootOnly());
        assertEquals(List.of(home.resolve("Apps"), Path.of("/opt/apps")), config.applicationDirs());
        assertEquals(home.resolve("state/ids.txt"), config.knownIdentifiersFile());
        assertEquals(home.resolve(".Trash"), config.trashDir());
    }

    @Test
    void parse_invalidValues_fallBackToDefaults(@TempDir Path tempDir) {
        Properties raw = new Properties();
        raw.setProperty(TidyboxConfigLoader.KEY_SCAN_THREADS, "-2");
        raw.setProperty(TidyboxConfigLoader.KEY_INCLUDE_ROOT_ONLY, "maybe");
        raw.setProperty(TidyboxConfigLoader.KEY_APPS_DIRS, "relative/apps");
        raw.setProperty(TidyboxConfigLoader.KEY_TRASH_DIR, "Trash");
        raw.setProperty(TidyboxConfigLoader.KEY_HOME, "not/absolute");

        TidyboxConfig config = TidyboxConfigLoader.parse(raw, tempDir, LOGGER);
        TidyboxConfig defaults = TidyboxConfig.defaults(tempDir);

        assertEquals(tempDir, config.home());
        assertEquals(defaults.scanThreads(), config.scanThreads());
        assertFalse(config.includeRootOnly());
        assertEquals(defaults.applicationDirs(), config.applicationDirs());
        assertEquals(defaults.trashDir(), config.trashDir());
    }

    @Test
    void parse_nonNumericThreads_usesDefault(@TempDir Path tempDir) {
        Properties raw = new Properties();
        raw.setProperty(TidyboxConfigLoader.KEY_SCAN_THREADS, "lots");

        TidyboxConfig config = TidyboxConfigLoader.parse(raw, tempDir, LOGGER);

        assertEquals(TidyboxConfigLoader.DEFAULT_SCAN_THREADS, config.scanThreads());
    }

    @Test
    void loadOrCreate_existingFile_isNotOverwritten(@TempDir Path tempDir) throws IOException {
        Path configPath = tempDir.resolve(TidyboxConfigLoader.FILE_NAME);
        Files.writeString(configPath, "scan.threads=5\n");

        TidyboxConfig config = TidyboxConfigLoader.loadOrCreate(configPath, tempDir, LOGGER);

        assertEquals(5, config.scanThreads());
        assertEquals("scan.threads=5\n", Files.readString(configPath));
    }
}
