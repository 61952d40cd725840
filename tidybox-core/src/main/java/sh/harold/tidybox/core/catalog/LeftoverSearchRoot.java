package sh.harold.tidybox.core.catalog;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Directory whose immediate children are checked for application residue.
 */
public record LeftoverSearchRoot(Path path, LeftoverCategory category) {
    public LeftoverSearchRoot {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(category, "category");
    }
}
