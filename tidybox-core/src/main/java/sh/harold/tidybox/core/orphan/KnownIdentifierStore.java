package sh.harold.tidybox.core.orphan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Remembers every application identifier seen installed, one per line.
 */
public final class KnownIdentifierStore {
    private final Path file;
    private final System.Logger logger;

    public KnownIdentifierStore(Path file, System.Logger logger) {
        this.file = Objects.requireNonNull(file, "file");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public Path file() {
        return file;
    }

    /**
     * Reads the stored identifiers. A missing or unreadable file yields an empty set.
     */
    public Set<String> load() {
        if (!Files.exists(file)) {
            return Set.of();
        }
        try {
            Set<String> identifiers = new TreeSet<>();
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String trimmed = line.strip();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                identifiers.add(trimmed);
            }
            return Set.copyOf(identifiers);
        } catch (IOException e) {
            logger.log(System.Logger.Level.WARNING, "Failed to read known identifiers from " + file, e);
            return Set.of();
        }
    }

    /**
     * Adds identifiers to the store and returns the merged set.
     */
    public Set<String> remember(Collection<String> identifiers) throws IOException {
        Objects.requireNonNull(identifiers, "identifiers");
        Set<String> merged = new TreeSet<>(load());
        for (String identifier : identifiers) {
            if (identifier != null && !identifier.isBlank()) {
                merged.add(identifier.strip());
            }
        }

        List<String> lines = new ArrayList<>(merged.size() + 1);
        lines.add("# Application identifiers seen installed");
        lines.addAll(merged);

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.write(temp, lines, StandardCharsets.UTF_8);
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
        return Set.copyOf(merged);
    }
}
