package sh.harold.tidybox.core.pattern;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import sh.harold.tidybox.core.catalog.CleanupPathDefinition;

/**
 * Expands cleanup patterns into paths that currently exist.
 *
 * <p>A wildcard is expanded one directory level only: the children of the directory before the
 * {@code *} are returned as-is, and any fixed segments after the wildcard are ignored, so
 * {@code /opt/homebrew/Caskroom/*}{@code /.metadata} yields the cask directories themselves.
 */
public final class PathPatternExpander {
    public static final String HOME_TOKEN = "~";

    private final Path home;
    private final System.Logger logger;

    public PathPatternExpander(Path home, System.Logger logger) {
        this.home = Objects.requireNonNull(home, "home");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public List<Path> expand(CleanupPathDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        return expand(definition.pattern());
    }

    public List<Path> expand(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        String expanded = expandHome(pattern);
        int wildcard = expanded.indexOf(CleanupPathDefinition.WILDCARD);
        try {
            if (wildcard < 0) {
                Path path = Path.of(expanded);
                return Files.exists(path, LinkOption.NOFOLLOW_LINKS) ? List.of(path) : List.of();
            }
            String prefix = expanded.substring(0, wildcard);
            if (prefix.isEmpty()) {
                return List.of();
            }
            return listChildren(prefixDirectory(prefix));
        } catch (InvalidPathException e) {
            logger.log(System.Logger.Level.DEBUG, "Ignoring unparseable pattern " + pattern);
            return List.of();
        }
    }

    /**
     * Replaces a leading home token with the home directory.
     */
    public String expandHome(String pattern) {
        if (pattern.equals(HOME_TOKEN)) {
            return home.toString();
        }
        if (pattern.startsWith(HOME_TOKEN + "/")) {
            return home + pattern.substring(HOME_TOKEN.length());
        }
        return pattern;
    }

    private static Path prefixDirectory(String prefix) {
        String trimmed = prefix;
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return Path.of(trimmed);
    }

    private List<Path> listChildren(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.sorted().toList();
        } catch (IOException | SecurityException e) {
            logger.log(System.Logger.Level.DEBUG, "Cannot list " + dir + " while expanding pattern", e);
            return List.of();
        }
    }
}
