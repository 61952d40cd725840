package sh.harold.tidybox.core.catalog;

/**
 * Kinds of residue an application leaves behind.
 */
public enum LeftoverCategory {
    CACHE("Cache"),
    PREFERENCES("Preferences"),
    APPLICATION_SUPPORT("Application Support"),
    CONTAINER("Container"),
    LOGS("Logs"),
    LAUNCH_ITEM("Launch Item"),
    COOKIES("Cookies"),
    SAVED_STATE("Saved State"),
    WEBKIT("WebKit Data"),
    CRASH_REPORTS("Crash Reports"),
    OTHER("Other");

    private final String displayName;

    LeftoverCategory(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
