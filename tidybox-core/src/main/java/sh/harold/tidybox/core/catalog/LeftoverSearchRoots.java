package sh.harold.tidybox.core.catalog;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Library locations searched for application leftovers, user roots first.
 */
public final class LeftoverSearchRoots {
    private LeftoverSearchRoots() {
    }

    public static List<LeftoverSearchRoot> userLibrary(Path home) {
        Objects.requireNonNull(home, "home");
        Path library = home.resolve("Library");
        return List.of(
            new LeftoverSearchRoot(library.resolve("Application Support"), LeftoverCategory.APPLICATION_SUPPORT),
            new LeftoverSearchRoot(library.resolve("Preferences"), LeftoverCategory.PREFERENCES),
            new LeftoverSearchRoot(library.resolve("Caches"), LeftoverCategory.CACHE),
            new LeftoverSearchRoot(library.resolve("Containers"), LeftoverCategory.CONTAINER),
            new LeftoverSearchRoot(library.resolve("Logs"), LeftoverCategory.LOGS),
            new LeftoverSearchRoot(library.resolve("Saved Application State"), LeftoverCategory.SAVED_STATE),
            new LeftoverSearchRoot(library.resolve("Cookies"), LeftoverCategory.COOKIES),
            new LeftoverSearchRoot(library.resolve("WebKit"), LeftoverCategory.WEBKIT),
            new LeftoverSearchRoot(library.resolve("HTTPStorages"), LeftoverCategory.CACHE),
            new LeftoverSearchRoot(library.resolve("Group Containers"), LeftoverCategory.CONTAINER),
            new LeftoverSearchRoot(library.resolve("Application Scripts"), LeftoverCategory.OTHER)
        );
    }

    /**
     * System roots, limited to directories whose entries the default safety policy lets us trash.
     */
    public static List<LeftoverSearchRoot> systemLibrary() {
        Path library = Path.of("/Library");
        return List.of(
            new LeftoverSearchRoot(library.resolve("Application Support"), LeftoverCategory.APPLICATION_SUPPORT),
            new LeftoverSearchRoot(library.resolve("Caches"), LeftoverCategory.CACHE),
            new LeftoverSearchRoot(library.resolve("LaunchAgents"), LeftoverCategory.LAUNCH_ITEM),
            new LeftoverSearchRoot(library.resolve("LaunchDaemons"), LeftoverCategory.LAUNCH_ITEM),
            new LeftoverSearchRoot(library.resolve("Logs").resolve("DiagnosticReports"), LeftoverCategory.CRASH_REPORTS)
        );
    }

    public static List<LeftoverSearchRoot> all(Path home) {
        List<LeftoverSearchRoot> roots = new ArrayList<>(userLibrary(home));
        roots.addAll(systemLibrary());
        return List.copyOf(roots);
    }
}
