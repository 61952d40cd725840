package sh.harold.tidybox.core.delete;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one deletion batch.
 */
public record DeletionResult(int successCount, int failedCount, List<DeletionError> errors, long freedBytes) {
    public DeletionResult {
        Objects.requireNonNull(errors, "errors");
        if (successCount < 0 || failedCount < 0) {
            throw new IllegalArgumentException("counts must be >= 0.");
        }
        if (freedBytes < 0) {
            throw new IllegalArgumentException("freedBytes must be >= 0.");
        }
        errors = List.copyOf(errors);
    }

    public static DeletionResult empty() {
        return new DeletionResult(0, 0, List.of(), 0L);
    }

    public boolean hasFailures() {
        return failedCount > 0;
    }
}
