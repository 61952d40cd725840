package sh.harold.tidybox.core.delete;

import java.nio.file.FileSystemException;
import java.nio.file.Path;

/**
 * Raised when a path already lives inside the trash it would be moved to.
 */
public final class AlreadyInTrashException extends FileSystemException {
    public AlreadyInTrashException(Path path, Path trashDir) {
        super(path.toString(), trashDir.toString(), "Already in the trash");
    }
}
