package sh.harold.tidybox.core.orphan;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * An application present on the machine. Identity is the bundle identifier alone.
 */
public record InstalledApp(
    UUID id,
    String name,
    String bundleIdentifier,
    Path path,
    String version,
    long sizeBytes
) {
    public InstalledApp {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(bundleIdentifier, "bundleIdentifier");
        Objects.requireNonNull(path, "path");
        if (bundleIdentifier.isBlank()) {
            throw new IllegalArgumentException("bundleIdentifier must be non-blank.");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must be >= 0.");
        }
    }

    public static InstalledApp of(String name, String bundleIdentifier, Path path, String version, long sizeBytes) {
        return new InstalledApp(UUID.randomUUID(), name, bundleIdentifier, path, version, sizeBytes);
    }

    /**
     * Developer segment of the identifier, e.g. {@code microsoft} for {@code com.microsoft.Word}.
     */
    public Optional<String> developerName() {
        return BundleIdentifiers.developerSegment(bundleIdentifier);
    }

    public Optional<String> versionString() {
        return Optional.ofNullable(version);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || other.getClass() != InstalledApp.class) {
            return false;
        }
        return bundleIdentifier.equals(((InstalledApp) other).bundleIdentifier);
    }

    @Override
    public int hashCode() {
        return bundleIdentifier.hashCode();
    }
}
