package sh.harold.tidybox.core.safety;

/**
 * Verdict kinds issued by {@link PathSafetyValidator}.
 */
public enum ValidationOutcome {
    SAFE("Path is safe to delete"),
    PROTECTED_PATH("Protected system path"),
    OUTSIDE_ALLOWED_PATHS("Path is outside allowed deletion directories"),
    SYMLINK_TO_PROTECTED("Symlink points to a protected location"),
    PATH_TRAVERSAL("Path contains traversal sequences (..)"),
    DOES_NOT_EXIST("Path does not exist"),
    INVALID_PATH("Invalid or malformed path");

    private final String reason;

    ValidationOutcome(String reason) {
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
