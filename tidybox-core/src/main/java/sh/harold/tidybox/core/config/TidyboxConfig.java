package sh.harold.tidybox.core.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Parsed configuration for Tidybox.
 */
public record TidyboxConfig(
    Path home,
    int scanThreads,
    boolean includeRootOnly,
    List<Path> applicationDirs,
    Path knownIdentifiersFile,
    Path trashDir
) {
    public TidyboxConfig {
        Objects.requireNonNull(home, "home");
        Objects.requireNonNull(applicationDirs, "applicationDirs");
        Objects.requireNonNull(knownIdentifiersFile, "knownIdentifiersFile");
        Objects.requireNonNull(trashDir, "trashDir");
        if (!home.isAbsolute()) {
            throw new IllegalArgumentException("home must be absolute.");
        }
        if (scanThreads <= 0) {
            throw new IllegalArgumentException("scanThreads must be > 0.");
        }
        applicationDirs = List.copyOf(applicationDirs);
    }

    public static TidyboxConfig defaults(Path home) {
        Objects.requireNonNull(home, "home");
        return new TidyboxConfig(
            home,
            TidyboxConfigLoader.DEFAULT_SCAN_THREADS,
            false,
            List.of(Path.of("/Applications"), home.resolve("Applications")),
            home.resolve(".tidybox").resolve("known-identifiers.txt"),
            home.resolve(".Trash")
        );
    }
}
