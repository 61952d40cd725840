package sh.harold.tidybox.core.permission;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A folder or file whose readability is tracked.
 *
 * @param requiresElevatedAccess readable only with full disk access
 * @param canTriggerConsentDialog reading it may raise a one-time OS consent prompt
 */
public record FolderAccessInfo(
    Path path,
    String displayName,
    boolean requiresElevatedAccess,
    boolean canTriggerConsentDialog,
    FolderAccessStatus status
) {
    public FolderAccessInfo {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(status, "status");
        if (!path.isAbsolute()) {
            throw new IllegalArgumentException("path must be absolute: " + path);
        }
        if (displayName.isBlank()) {
            throw new IllegalArgumentException("displayName must be non-blank.");
        }
    }

    public static FolderAccessInfo of(Path path, String displayName, boolean requiresElevatedAccess, boolean canTriggerConsentDialog) {
        return new FolderAccessInfo(path, displayName, requiresElevatedAccess, canTriggerConsentDialog, FolderAccessStatus.UNCHECKED);
    }

    public FolderAccessInfo withStatus(FolderAccessStatus next) {
        return new FolderAccessInfo(path, displayName, requiresElevatedAccess, canTriggerConsentDialog, next);
    }
}
