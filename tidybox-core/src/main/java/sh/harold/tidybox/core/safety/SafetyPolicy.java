package sh.harold.tidybox.core.safety;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable catalogs consulted by {@link PathSafetyValidator}.
 */
public record SafetyPolicy(
    Path home,
    Set<Path> protectedPaths,
    Set<Path> protectedHomePaths,
    List<AllowedRoot> allowedRoots
) {
    private static final List<String> SYSTEM_PROTECTED = List.of(
        "/", "/System", "/Library", "/Users", "/Applications",
        "/bin", "/sbin", "/usr", "/var", "/private", "/etc", "/tmp",
        "/cores", "/dev", "/opt", "/Volumes"
    );

    private static final List<String> HOME_PROTECTED = List.of(
        "Desktop", "Documents", "Downloads", "Movies", "Music", "Pictures", "Public"
    );

    private static final List<String> HOME_ALLOWED = List.of(
        "Library/Caches",
        "Library/Logs",
        "Library/Application Support",
        "Library/Containers",
        "Library/Saved Application State",
        "Library/Cookies",
        "Library/HTTPStorages",
        "Library/WebKit",
        "Library/Preferences",
        "Library/Group Containers",
        "Library/Application Scripts",
        ".Trash",
        "Library/Developer/Xcode/DerivedData",
        "Library/Developer/Xcode/Archives",
        "Library/Developer/Xcode/iOS DeviceSupport",
        "Library/Developer/CoreSimulator",
        ".npm",
        ".cache",
        ".gradle/caches",
        ".local/share/Trash"
    );

    private static final List<String> SYSTEM_ALLOWED = List.of(
        "/Library/Caches",
        "/Library/Logs",
        "/Library/LaunchAgents",
        "/Library/LaunchDaemons",
        "/Library/Application Support",
        "/private/var/folders"
    );

    public SafetyPolicy {
        Objects.requireNonNull(home, "home");
        Objects.requireNonNull(protectedPaths, "protectedPaths");
        Objects.requireNonNull(protectedHomePaths, "protectedHomePaths");
        Objects.requireNonNull(allowedRoots, "allowedRoots");
        if (!home.isAbsolute()) {
            throw new IllegalArgumentException("home must be absolute: " + home);
        }
        home = home.normalize();
        protectedPaths = Set.copyOf(protectedPaths);
        protectedHomePaths = Set.copyOf(protectedHomePaths);
        allowedRoots = List.copyOf(allowedRoots);
    }

    /**
     * Builds the default policy for a user whose home directory is {@code home}.
     */
    public static SafetyPolicy forHome(Path home) {
        Objects.requireNonNull(home, "home");
        Path normalizedHome = home.toAbsolutePath().normalize();

        Set<Path> protectedPaths = new LinkedHashSet<>();
        for (String path : SYSTEM_PROTECTED) {
            protectedPaths.add(Path.of(path));
        }
        protectedPaths.add(normalizedHome);

        Set<Path> protectedHomePaths = new LinkedHashSet<>();
        for (String name : HOME_PROTECTED) {
            protectedHomePaths.add(normalizedHome.resolve(name));
        }

        List<AllowedRoot> allowed = new ArrayList<>();
        for (String relative : HOME_ALLOWED) {
            allowed.add(AllowedRoot.of(normalizedHome.resolve(relative)));
        }
        for (String absolute : SYSTEM_ALLOWED) {
            allowed.add(AllowedRoot.of(Path.of(absolute)));
        }
        return new SafetyPolicy(normalizedHome, protectedPaths, protectedHomePaths, allowed);
    }

    public boolean isProtected(Path normalized) {
        return protectedPaths.contains(normalized) || protectedHomePaths.contains(normalized);
    }
}
