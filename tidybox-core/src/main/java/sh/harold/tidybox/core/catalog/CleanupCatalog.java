package sh.harold.tidybox.core.catalog;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Built-in cleanup locations.
 */
public final class CleanupCatalog {
    private static final List<CleanupPathDefinition> SYSTEM_CACHES = List.of(
        CleanupPathDefinition.user("~/Library/Caches/*", CleanupCategory.USER_CACHES,
            "User application caches"),
        new CleanupPathDefinition("/Library/Caches/*", CleanupCategory.SYSTEM_CACHES,
            "System-wide caches", true, true)
    );

    private static final List<CleanupPathDefinition> LOGS = List.of(
        CleanupPathDefinition.user("~/Library/Logs/*", CleanupCategory.LOGS, "User application logs"),
        new CleanupPathDefinition("/Library/Logs/*", CleanupCategory.LOGS, "System logs", true, true),
        // Some system logs are needed by the OS; never preselected.
        new CleanupPathDefinition("/private/var/log/*", CleanupCategory.LOGS, "System log files", true, false)
    );

    private static final List<CleanupPathDefinition> XCODE = List.of(
        CleanupPathDefinition.user("~/Library/Developer/Xcode/DerivedData/*",
            CleanupCategory.XCODE_DERIVED_DATA, "Xcode build artifacts and indexes"),
        new CleanupPathDefinition("~/Library/Developer/Xcode/Archives/*", CleanupCategory.XCODE_ARCHIVES,
            "Xcode app archives", false, false),
        CleanupPathDefinition.user("~/Library/Developer/Xcode/iOS DeviceSupport/*",
            CleanupCategory.XCODE_DEVICE_SUPPORT, "iOS device debug symbols"),
        CleanupPathDefinition.user("~/Library/Developer/CoreSimulator/Caches/*",
            CleanupCategory.XCODE_DERIVED_DATA, "CoreSimulator caches")
    );

    private static final List<CleanupPathDefinition> PACKAGE_MANAGERS = List.of(
        CleanupPathDefinition.user("~/Library/Caches/Homebrew/*", CleanupCategory.HOMEBREW,
            "Homebrew downloaded packages"),
        // Expands one level only: yields the cask directories, which the validator then rejects.
        CleanupPathDefinition.user("/opt/homebrew/Caskroom/*/.metadata", CleanupCategory.HOMEBREW,
            "Homebrew Cask metadata"),
        CleanupPathDefinition.user("/usr/local/Caskroom/*/.metadata", CleanupCategory.HOMEBREW,
            "Homebrew Cask metadata (Intel)"),
        CleanupPathDefinition.user("~/.npm/_cacache/*", CleanupCategory.NPM, "npm package cache"),
        CleanupPathDefinition.user("~/.npm/_logs/*", CleanupCategory.NPM, "npm log files"),
        CleanupPathDefinition.user("~/Library/Caches/pip/*", CleanupCategory.PIP, "Python pip cache")
    );

    private static final List<CleanupPathDefinition> OTHER_CACHES = List.of(
        CleanupPathDefinition.user("~/.cache/*", CleanupCategory.USER_CACHES, "XDG cache directory")
    );

    // Listed for its size only; moving items to the trash frees nothing.
    private static final List<CleanupPathDefinition> TRASH = List.of(
        new CleanupPathDefinition("~/.Trash/*", CleanupCategory.TRASH, "User Trash", false, false)
    );

    private static final List<CleanupPathDefinition> ALL = concat(
        SYSTEM_CACHES, LOGS, XCODE, PACKAGE_MANAGERS, OTHER_CACHES, TRASH
    );

    private CleanupCatalog() {
    }

    public static List<CleanupPathDefinition> all() {
        return ALL;
    }

    public static List<CleanupPathDefinition> safeToClean() {
        return ALL.stream().filter(CleanupPathDefinition::safeToClean).toList();
    }

    public static List<CleanupPathDefinition> forCategory(CleanupCategory category) {
        Objects.requireNonNull(category, "category");
        return ALL.stream().filter(definition -> definition.category() == category).toList();
    }

    @SafeVarargs
    private static List<CleanupPathDefinition> concat(List<CleanupPathDefinition>... groups) {
        return Arrays.stream(groups).flatMap(List::stream).toList();
    }
}
