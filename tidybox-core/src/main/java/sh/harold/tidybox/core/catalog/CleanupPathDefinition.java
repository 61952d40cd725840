package sh.harold.tidybox.core.catalog;

import java.util.Objects;

/**
 * Static description of one cleanup location.
 *
 * <p>The pattern may start with {@code ~} for the home directory and may hold at most one
 * {@code *} wildcard.
 */
public record CleanupPathDefinition(
    String pattern,
    CleanupCategory category,
    String description,
    boolean requiresRoot,
    boolean safeToClean
) {
    public static final char WILDCARD = '*';

    public CleanupPathDefinition {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(description, "description");
        if (pattern.isBlank()) {
            throw new IllegalArgumentException("pattern must be non-blank.");
        }
        if (pattern.indexOf(WILDCARD) != pattern.lastIndexOf(WILDCARD)) {
            throw new IllegalArgumentException("pattern may contain at most one wildcard: " + pattern);
        }
    }

    public static CleanupPathDefinition user(String pattern, CleanupCategory category, String description) {
        return new CleanupPathDefinition(pattern, category, description, false, true);
    }

    public boolean hasWildcard() {
        return pattern.indexOf(WILDCARD) >= 0;
    }
}
