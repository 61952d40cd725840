package sh.harold.tidybox.core.orphan;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import sh.harold.tidybox.core.catalog.LeftoverCategory;

/**
 * Residue attributed to an application that is no longer installed.
 */
public record LeftoverFile(
    Path path,
    long sizeBytes,
    LeftoverCategory category,
    Confidence confidence,
    String relatedIdentifier,
    Instant lastModified
) {
    public LeftoverFile {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(confidence, "confidence");
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be >= 0.");
        }
    }

    public String name() {
        Path fileName = path.getFileName();
        return fileName == null ? path.toString() : fileName.toString();
    }

    public Optional<String> related() {
        return Optional.ofNullable(relatedIdentifier);
    }

    public Optional<Instant> modifiedAt() {
        return Optional.ofNullable(lastModified);
    }

    public OptionalLong daysSinceModified(Clock clock) {
        Objects.requireNonNull(clock, "clock");
        if (lastModified == null) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(Math.max(0L, Duration.between(lastModified, clock.instant()).toDays()));
    }
}
