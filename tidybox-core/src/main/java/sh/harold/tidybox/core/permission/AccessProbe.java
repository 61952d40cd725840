package sh.harold.tidybox.core.permission;

import java.nio.file.Path;

/**
 * Attempts to read a path and reports the outcome.
 *
 * <p>Returns only {@link FolderAccessStatus#ACCESSIBLE}, {@link FolderAccessStatus#DENIED} or
 * {@link FolderAccessStatus#NOT_EXISTS}.
 */
@FunctionalInterface
public interface AccessProbe {
    FolderAccessStatus probe(Path path);
}
