package sh.harold.tidybox.core.catalog;

import java.util.Locale;
import java.util.Objects;

/**
 * Groups cleanup targets for display and selection.
 */
public enum CleanupCategory {
    SYSTEM_CACHES("System Caches"),
    USER_CACHES("User Caches"),
    LOGS("Logs"),
    TRASH("Trash"),
    XCODE_DERIVED_DATA("Xcode Derived Data"),
    XCODE_ARCHIVES("Xcode Archives"),
    XCODE_DEVICE_SUPPORT("Xcode Device Support"),
    HOMEBREW("Homebrew Cache"),
    NPM("npm Cache"),
    PIP("pip Cache");

    private final String displayName;

    CleanupCategory(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolves a category from its constant name or display name, ignoring case.
     */
    public static CleanupCategory parse(String value) {
        Objects.requireNonNull(value, "value");
        String normalized = value.trim().replace('-', '_').replace(' ', '_').toUpperCase(Locale.ROOT);
        for (CleanupCategory category : values()) {
            if (category.name().equals(normalized) || category.displayName.equalsIgnoreCase(value.trim())) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown cleanup category: " + value);
    }
}
