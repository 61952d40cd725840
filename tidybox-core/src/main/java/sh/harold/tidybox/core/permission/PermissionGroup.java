package sh.harold.tidybox.core.permission;

import java.util.List;
import java.util.Objects;

/**
 * Folders of one permission category, in display order.
 */
public record PermissionGroup(PermissionCategoryType type, List<FolderAccessInfo> folders) {
    public PermissionGroup {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(folders, "folders");
        folders = List.copyOf(folders);
    }

    public FolderAccessStatus overallStatus() {
        return FolderAccessStatus.rollup(folders.stream().map(FolderAccessInfo::status).toList());
    }

    public int accessibleCount() {
        return (int) folders.stream().filter(folder -> folder.status() == FolderAccessStatus.ACCESSIBLE).count();
    }

    /**
     * Folders known to exist or not yet known not to.
     */
    public int existingCount() {
        return (int) folders.stream().filter(folder -> folder.status() != FolderAccessStatus.NOT_EXISTS).count();
    }

    public String summary() {
        int existing = existingCount();
        if (existing == 0) {
            return "No folders";
        }
        return accessibleCount() + "/" + existing;
    }
}
