package sh.harold.tidybox.core.fs;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Raised when the size of a path cannot be determined.
 */
public final class PathSizeException extends IOException {
    private final Path path;
    private final Reason reason;

    public PathSizeException(Path path, Reason reason, Throwable cause) {
        super(reason.describe(path), cause);
        this.path = Objects.requireNonNull(path, "path");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Path path() {
        return path;
    }

    public Reason reason() {
        return reason;
    }

    public enum Reason {
        NOT_FOUND("Path does not exist"),
        STAT_FAILED("Cannot read file attributes"),
        ENUMERATION_FAILED("Cannot enumerate directory contents");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        String describe(Path path) {
            return message + ": " + path;
        }
    }
}
