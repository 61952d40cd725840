package sh.harold.tidybox.core.safety;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * Directory inside which deletion is permitted.
 *
 * @param path absolute, normalized root
 * @param selfDeletable whether the root itself may be deleted, not only its descendants
 */
public record AllowedRoot(Path path, boolean selfDeletable) {
    private static final Set<String> LEAF_NAMES = Set.of("Caches", "DerivedData", ".Trash", "Trash", ".cache");

    public AllowedRoot {
        Objects.requireNonNull(path, "path");
        if (!path.isAbsolute()) {
            throw new IllegalArgumentException("allowed root must be absolute: " + path);
        }
        path = path.normalize();
    }

    /**
     * Creates a root that is self-deletable only when its own name marks it as a leaf cache,
     * derived-data or trash directory.
     */
    public static AllowedRoot of(Path path) {
        Path fileName = path.getFileName();
        return new AllowedRoot(path, fileName != null && LEAF_NAMES.contains(fileName.toString()));
    }

    public boolean permits(Path normalized) {
        if (normalized.equals(path)) {
            return selfDeletable;
        }
        return normalized.startsWith(path);
    }
}
