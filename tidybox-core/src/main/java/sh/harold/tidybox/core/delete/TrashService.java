package sh.harold.tidybox.core.delete;

import java.awt.Desktop;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Moves a path to the trash. The only deletion primitive Tidybox uses.
 */
@FunctionalInterface
public interface TrashService {
    void moveToTrash(Path path) throws IOException;

    /**
     * Moves into {@code trashDir}, appending a counter to the name when it is taken. Paths already
     * inside {@code trashDir} are refused with {@link AlreadyInTrashException}.
     */
    static TrashService directoryTrash(Path trashDir) {
        Objects.requireNonNull(trashDir, "trashDir");
        Path trashRoot = trashDir.toAbsolutePath().normalize();
        return path -> {
            if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
                throw new NoSuchFileException(path.toString());
            }
            if (path.toAbsolutePath().normalize().startsWith(trashRoot)) {
                throw new AlreadyInTrashException(path, trashDir);
            }
            Files.createDirectories(trashDir);
            Files.move(path, uniqueTarget(trashDir, path.getFileName().toString()));
        };
    }

    /**
     * Uses the desktop's own trash when the platform offers one, otherwise {@code fallback}.
     */
    static TrashService desktopTrash(TrashService fallback) {
        Objects.requireNonNull(fallback, "fallback");
        if (!Desktop.isDesktopSupported() || !Desktop.getDesktop().isSupported(Desktop.Action.MOVE_TO_TRASH)) {
            return fallback;
        }
        Desktop desktop = Desktop.getDesktop();
        return path -> {
            if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
                throw new NoSuchFileException(path.toString());
            }
            if (!desktop.moveToTrash(path.toFile())) {
                throw new IOException("Desktop refused to move " + path + " to the trash");
            }
        };
    }

    private static Path uniqueTarget(Path trashDir, String name) {
        Path target = trashDir.resolve(name);
        int counter = 2;
        while (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            target = trashDir.resolve(name + " " + counter);
            counter++;
        }
        return target;
    }
}
