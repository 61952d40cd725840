package sh.harold.tidybox.core.permission;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the current access status of every tracked folder.
 *
 * <p>All reads and updates go through this object; callers receive immutable snapshots.
 */
public final class PermissionCatalog {
    private final Clock clock;
    private final List<PermissionCategoryType> order;
    private final Map<Path, FolderAccessInfo> folders = new LinkedHashMap<>();
    private final Map<Path, PermissionCategoryType> categories = new LinkedHashMap<>();
    private Instant lastChecked;

    public PermissionCatalog(List<PermissionGroup> groups, Clock clock) {
        Objects.requireNonNull(groups, "groups");
        this.clock = Objects.requireNonNull(clock, "clock");
        List<PermissionCategoryType> types = new ArrayList<>();
        for (PermissionGroup group : groups) {
            types.add(group.type());
            for (FolderAccessInfo folder : group.folders()) {
                if (folders.putIfAbsent(folder.path(), folder) != null) {
                    throw new IllegalArgumentException("duplicate folder: " + folder.path());
                }
                categories.put(folder.path(), group.type());
            }
        }
        this.order = List.copyOf(types);
    }

    /**
     * Folders checked on macOS for a user whose home directory is {@code home}.
     */
    public static PermissionCatalog defaults(Path home, Clock clock) {
        Objects.requireNonNull(home, "home");
        Path library = home.resolve("Library");
        Path systemLibrary = Path.of("/Library");
        Path appleLibrary = Path.of("/System/Library");
        return new PermissionCatalog(List.of(
            new PermissionGroup(PermissionCategoryType.FULL_DISK_ACCESS, List.of(
                FolderAccessInfo.of(library.resolve("Application Support/com.apple.TCC/TCC.db"), "TCC Database", true, false),
                FolderAccessInfo.of(library.resolve("Safari/Bookmarks.plist"), "Safari Bookmarks", true, false),
                FolderAccessInfo.of(library.resolve("Mail"), "Mail Library", true, false),
                FolderAccessInfo.of(
                    library.resolve("Containers/com.apple.mail/Data/Library/Mail Downloads"),
                    "Mail Attachments",
                    true,
                    false
                )
            )),
            new PermissionGroup(PermissionCategoryType.USER_FOLDERS, List.of(
                FolderAccessInfo.of(home.resolve("Downloads"), "Downloads", false, true),
                FolderAccessInfo.of(home.resolve("Documents"), "Documents", false, true),
                FolderAccessInfo.of(home.resolve("Desktop"), "Desktop", false, true)
            )),
            new PermissionGroup(PermissionCategoryType.SYSTEM_FOLDERS, List.of(
                FolderAccessInfo.of(systemLibrary.resolve("Caches"), "System Caches", true, false),
                FolderAccessInfo.of(systemLibrary.resolve("Logs"), "System Logs", true, false),
                FolderAccessInfo.of(systemLibrary.resolve("LaunchAgents"), "System Launch Agents", false, false),
                FolderAccessInfo.of(systemLibrary.resolve("LaunchDaemons"), "System Launch Daemons", false, false)
            )),
            new PermissionGroup(PermissionCategoryType.APPLICATION_DATA, List.of(
                FolderAccessInfo.of(library.resolve("Caches"), "User Caches", false, false),
                FolderAccessInfo.of(library.resolve("Logs"), "User Logs", false, false),
                FolderAccessInfo.of(library.resolve("Caches/com.apple.Safari"), "Safari Cache", false, false),
                FolderAccessInfo.of(library.resolve("Caches/Google/Chrome"), "Chrome Cache", false, false),
                FolderAccessInfo.of(library.resolve("Developer/Xcode/DerivedData"), "Xcode DerivedData", false, false),
                FolderAccessInfo.of(home.resolve(".Trash"), "Trash", false, false)
            )),
            new PermissionGroup(PermissionCategoryType.STARTUP_PATHS, List.of(
                FolderAccessInfo.of(library.resolve("LaunchAgents"), "User Launch Agents", false, false),
                FolderAccessInfo.of(appleLibrary.resolve("LaunchAgents"), "Apple Launch Agents", false, false),
                FolderAccessInfo.of(appleLibrary.resolve("LaunchDaemons"), "Apple Launch Daemons", false, false)
            ))
        ), clock);
    }

    public synchronized List<PermissionGroup> snapshot() {
        Map<PermissionCategoryType, List<FolderAccessInfo>> grouped = new LinkedHashMap<>();
        for (PermissionCategoryType type : order) {
            grouped.put(type, new ArrayList<>());
        }
        for (FolderAccessInfo folder : folders.values()) {
            grouped.get(categories.get(folder.path())).add(folder);
        }
        List<PermissionGroup> groups = new ArrayList<>(grouped.size());
        for (Map.Entry<PermissionCategoryType, List<FolderAccessInfo>> entry : grouped.entrySet()) {
            groups.add(new PermissionGroup(entry.getKey(), entry.getValue()));
        }
        return List.copyOf(groups);
    }

    public synchronized List<FolderAccessInfo> folders() {
        return List.copyOf(folders.values());
    }

    public synchronized Optional<FolderAccessInfo> folder(Path path) {
        return Optional.ofNullable(folders.get(path));
    }

    /**
     * Sets every given folder to {@link FolderAccessStatus#CHECKING} and returns what each was before.
     */
    public synchronized Map<Path, FolderAccessStatus> markChecking(Collection<Path> paths) {
        Objects.requireNonNull(paths, "paths");
        Map<Path, FolderAccessStatus> previous = new LinkedHashMap<>();
        for (Path path : paths) {
            FolderAccessInfo folder = requireFolder(path);
            previous.put(path, folder.status());
            folders.put(path, folder.withStatus(FolderAccessStatus.CHECKING));
        }
        return previous;
    }

    public synchronized void apply(Path path, FolderAccessStatus status) {
        Objects.requireNonNull(status, "status");
        folders.put(path, requireFolder(path).withStatus(status));
    }

    public synchronized void markChecked() {
        lastChecked = clock.instant();
    }

    public synchronized Optional<Instant> lastChecked() {
        return Optional.ofNullable(lastChecked);
    }

    /**
     * Rollup over the folders that need full disk access to read.
     */
    public synchronized FolderAccessStatus elevatedAccessStatus() {
        return FolderAccessStatus.rollup(folders.values().stream()
            .filter(FolderAccessInfo::requiresElevatedAccess)
            .map(FolderAccessInfo::status)
            .toList());
    }

    private FolderAccessInfo requireFolder(Path path) {
        Objects.requireNonNull(path, "path");
        FolderAccessInfo folder = folders.get(path);
        if (folder == null) {
            throw new IllegalArgumentException("unknown folder: " + path);
        }
        return folder;
    }
}
