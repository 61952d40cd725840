package sh.harold.tidybox.core.permission;

public enum PermissionCategoryType {
    FULL_DISK_ACCESS("Full Disk Access", true, false),
    USER_FOLDERS("User Folders", false, true),
    SYSTEM_FOLDERS("System Folders", true, false),
    APPLICATION_DATA("Application Data", false, false),
    STARTUP_PATHS("Startup Paths", false, false);

    private final String displayName;
    private final boolean requiresSystemSettings;
    private final boolean usesConsentDialogs;

    PermissionCategoryType(String displayName, boolean requiresSystemSettings, boolean usesConsentDialogs) {
        this.displayName = displayName;
        this.requiresSystemSettings = requiresSystemSettings;
        this.usesConsentDialogs = usesConsentDialogs;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Access for this group is granted in System Settings rather than per folder.
     */
    public boolean requiresSystemSettings() {
        return requiresSystemSettings;
    }

    public boolean usesConsentDialogs() {
        return usesConsentDialogs;
    }
}
