package sh.harold.tidybox.core.scan;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;
import java.util.UUID;
import sh.harold.tidybox.core.catalog.CleanupCategory;

/**
 * A concrete path offered for cleanup.
 */
public record CleanableItem(
    UUID id,
    Path path,
    String name,
    long sizeBytes,
    CleanupCategory category,
    boolean selected
) {
    public CleanableItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be >= 0.");
        }
    }

    /**
     * Creates an item whose id is derived from its path, so rescans keep ids stable.
     */
    public static CleanableItem of(Path path, long sizeBytes, CleanupCategory category, boolean selected) {
        Objects.requireNonNull(path, "path");
        UUID id = UUID.nameUUIDFromBytes(path.toString().getBytes(StandardCharsets.UTF_8));
        Path fileName = path.getFileName();
        String name = fileName == null ? path.toString() : fileName.toString();
        return new CleanableItem(id, path, name, sizeBytes, category, selected);
    }

    public CleanableItem withSelected(boolean selected) {
        if (selected == this.selected) {
            return this;
        }
        return new CleanableItem(id, path, name, sizeBytes, category, selected);
    }
}
