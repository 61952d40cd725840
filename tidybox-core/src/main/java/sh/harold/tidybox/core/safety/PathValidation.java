package sh.harold.tidybox.core.safety;

import java.util.Objects;

/**
 * A path paired with its validation result.
 */
public record PathValidation(String path, ValidationResult result) {
    public PathValidation {
        Objects.requireNonNull(result, "result");
    }
}
