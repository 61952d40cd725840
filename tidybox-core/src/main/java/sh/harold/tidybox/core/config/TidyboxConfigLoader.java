package sh.harold.tidybox.core.config;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * Loads {@link TidyboxConfig} from a properties file.
 *
 * <p>Missing files are created with defaults. Invalid values fall back to their defaults with a
 * warning; a bad config never stops the host.
 */
public final class TidyboxConfigLoader {
    public static final String FILE_NAME = "tidybox.properties";

    static final int DEFAULT_SCAN_THREADS = Math.max(2, Math.min(8, Runtime.getRuntime().availableProcessors()));

    static final String KEY_HOME = "home";
    static final String KEY_SCAN_THREADS = "scan.threads";
    static final String KEY_INCLUDE_ROOT_ONLY = "scan.includeRootOnly";
    static final String KEY_APPS_DIRS = "apps.dirs";
    static final String KEY_KNOWN_IDENTIFIERS = "orphans.knownIdentifiersFile";
    static final String KEY_TRASH_DIR = "trash.dir";

    private static final String HOME_TOKEN = "~";
    private static final String LIST_SEPARATOR = ",";

    private TidyboxConfigLoader() {
    }

    public static Path defaultPath(Path userHome) {
        Objects.requireNonNull(userHome, "userHome");
        return userHome.resolve(".tidybox").resolve(FILE_NAME);
    }

    public static TidyboxConfig loadOrCreate(Path configPath, Path userHome, System.Logger logger) {
        Objects.requireNonNull(configPath, "configPath");
        Objects.requireNonNull(userHome, "userHome");
        Objects.requireNonNull(logger, "logger");

        if (!Files.exists(configPath)) {
            TidyboxConfig defaults = TidyboxConfig.defaults(userHome);
            try {
                write(configPath, defaults);
                logger.log(System.Logger.Level.INFO, "Wrote default config: " + configPath);
            } catch (IOException e) {
                logger.log(System.Logger.Level.WARNING, "Failed to write default Tidybox config to " + configPath, e);
            }
            return defaults;
        }

        Properties raw = new Properties();
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            raw.load(reader);
        } catch (IOException | IllegalArgumentException e) {
            logger.log(
                System.Logger.Level.WARNING,
                "Failed to load Tidybox config from " + configPath + "; using defaults.",
                e
            );
            return TidyboxConfig.defaults(userHome);
        }
        return parse(raw, userHome, logger);
    }

    static TidyboxConfig parse(Properties raw, Path userHome, System.Logger logger) {
        Path home = path(raw.getProperty(KEY_HOME), userHome, userHome, KEY_HOME, logger);
        TidyboxConfig defaults = TidyboxConfig.defaults(home);

        int threads = positiveInt(raw.getProperty(KEY_SCAN_THREADS), defaults.scanThreads(), KEY_SCAN_THREADS, logger);
        boolean includeRootOnly = Boolean.parseBoolean(
            raw.getProperty(KEY_INCLUDE_ROOT_ONLY, Boolean.toString(defaults.includeRootOnly())).strip()
        );
        List<Path> appDirs = pathList(raw.getProperty(KEY_APPS_DIRS), home, defaults.applicationDirs(), logger);
        Path knownIdentifiers = path(
            raw.getProperty(KEY_KNOWN_IDENTIFIERS),
            home,
            defaults.knownIdentifiersFile(),
            KEY_KNOWN_IDENTIFIERS,
            logger
        );
        Path trashDir = path(raw.getProperty(KEY_TRASH_DIR), home, defaults.trashDir(), KEY_TRASH_DIR, logger);

        try {
            return new TidyboxConfig(home, threads, includeRootOnly, appDirs, knownIdentifiers, trashDir);
        } catch (RuntimeException e) {
            logger.log(System.Logger.Level.WARNING, "Invalid Tidybox config; falling back to defaults.", e);
            return TidyboxConfig.defaults(userHome);
        }
    }

    static void write(Path configPath, TidyboxConfig config) throws IOException {
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Properties out = new Properties();
        out.setProperty(KEY_HOME, config.home().toString());
        out.setProperty(KEY_SCAN_THREADS, Integer.toString(config.scanThreads()));
        out.setProperty(KEY_INCLUDE_ROOT_ONLY, Boolean.toString(config.includeRootOnly()));
        out.setProperty(KEY_APPS_DIRS, String.join(
            LIST_SEPARATOR,
            config.applicationDirs().stream().map(Path::toString).toList()
        ));
        out.setProperty(KEY_KNOWN_IDENTIFIERS, config.knownIdentifiersFile().toString());
        out.setProperty(KEY_TRASH_DIR, config.trashDir().toString());
        try (Writer writer = Files.newBufferedWriter(configPath, StandardCharsets.UTF_8)) {
            out.store(writer, "Tidybox configuration");
        }
    }

    private static int positiveInt(String value, int defaultValue, String key, System.Logger logger) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value.strip());
        } catch (NumberFormatException e) {
            parsed = 0;
        }
        if (parsed <= 0) {
            logger.log(System.Logger.Level.WARNING, "Config " + key + " must be > 0; using default " + defaultValue + ".");
            return defaultValue;
        }
        return parsed;
    }

    private static Path path(String value, Path home, Path defaultValue, String key, System.Logger logger) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        Path parsed = expand(value.strip(), home);
        if (parsed == null || !parsed.isAbsolute()) {
            logger.log(System.Logger.Level.WARNING, "Config " + key + " must be an absolute path; using default " + defaultValue + ".");
            return defaultValue;
        }
        return parsed.normalize();
    }

    private static Path expand(String value, Path home) {
        try {
            if (value.equals(HOME_TOKEN)) {
                return home;
            }
            if (value.startsWith(HOME_TOKEN + "/")) {
                return home.resolve(value.substring(2));
            }
            return Path.of(value);
        } catch (InvalidPathException e) {
            return null;
        }
    }

    private static List<Path> pathList(String value, Path home, List<Path> defaultValue, System.Logger logger) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        List<Path> paths = new ArrayList<>();
        for (String part : value.split(LIST_SEPARATOR)) {
            if (part.isBlank()) {
                continue;
            }
            Path parsed = path(part, home, null, KEY_APPS_DIRS, logger);
            if (parsed != null) {
                paths.add(parsed);
            }
        }
        return paths.isEmpty() ? defaultValue : paths;
    }
}
