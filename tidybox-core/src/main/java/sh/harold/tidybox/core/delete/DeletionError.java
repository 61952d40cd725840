package sh.harold.tidybox.core.delete;

import java.util.Objects;

public record DeletionError(String path, FailureKind kind, String reason) {
    public DeletionError {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(reason, "reason");
    }
}
