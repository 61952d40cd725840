package sh.harold.tidybox.core.delete;

import java.util.Objects;
import sh.harold.tidybox.core.orphan.LeftoverFile;
import sh.harold.tidybox.core.scan.CleanableItem;

/**
 * A path offered for deletion with the size recorded when it was scanned.
 */
public record DeletionCandidate(String path, long sizeBytes) {
    public DeletionCandidate {
        Objects.requireNonNull(path, "path");
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be >= 0.");
        }
    }

    public static DeletionCandidate of(CleanableItem item) {
        return new DeletionCandidate(item.path().toString(), item.sizeBytes());
    }

    public static DeletionCandidate of(LeftoverFile leftover) {
        return new DeletionCandidate(leftover.path().toString(), leftover.sizeBytes());
    }
}
