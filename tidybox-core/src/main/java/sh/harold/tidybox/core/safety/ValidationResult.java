package sh.harold.tidybox.core.safety;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of validating one path.
 *
 * @param outcome verdict kind
 * @param protectedPath the protected entry that matched, only for {@link ValidationOutcome#PROTECTED_PATH}
 */
public record ValidationResult(ValidationOutcome outcome, String protectedPath) {
    private static final ValidationResult SAFE = new ValidationResult(ValidationOutcome.SAFE, null);
    private static final ValidationResult OUTSIDE = new ValidationResult(ValidationOutcome.OUTSIDE_ALLOWED_PATHS, null);
    private static final ValidationResult SYMLINK = new ValidationResult(ValidationOutcome.SYMLINK_TO_PROTECTED, null);
    private static final ValidationResult TRAVERSAL = new ValidationResult(ValidationOutcome.PATH_TRAVERSAL, null);
    private static final ValidationResult MISSING = new ValidationResult(ValidationOutcome.DOES_NOT_EXIST, null);
    private static final ValidationResult INVALID = new ValidationResult(ValidationOutcome.INVALID_PATH, null);

    public ValidationResult {
        Objects.requireNonNull(outcome, "outcome");
        if (outcome == ValidationOutcome.PROTECTED_PATH) {
            Objects.requireNonNull(protectedPath, "protectedPath");
        } else if (protectedPath != null) {
            throw new IllegalArgumentException("protectedPath is only valid for PROTECTED_PATH.");
        }
    }

    public static ValidationResult safe() {
        return SAFE;
    }

    public static ValidationResult protectedPath(String which) {
        return new ValidationResult(ValidationOutcome.PROTECTED_PATH, which);
    }

    public static ValidationResult outsideAllowedPaths() {
        return OUTSIDE;
    }

    public static ValidationResult symlinkToProtected() {
        return SYMLINK;
    }

    public static ValidationResult pathTraversal() {
        return TRAVERSAL;
    }

    public static ValidationResult doesNotExist() {
        return MISSING;
    }

    public static ValidationResult invalidPath() {
        return INVALID;
    }

    public boolean isSafe() {
        return outcome == ValidationOutcome.SAFE;
    }

    public Optional<String> protectedEntry() {
        return Optional.ofNullable(protectedPath);
    }

    public String reason() {
        if (outcome == ValidationOutcome.PROTECTED_PATH) {
            return outcome.reason() + ": " + protectedPath;
        }
        return outcome.reason();
    }
}
