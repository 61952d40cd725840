package sh.harold.tidybox.core.permission;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Probes by listing a directory or reading a file to the end.
 */
public final class FileSystemAccessProbe implements AccessProbe {
    private final System.Logger logger;

    public FileSystemAccessProbe(System.Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public FolderAccessStatus probe(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.exists(path)) {
            return FolderAccessStatus.NOT_EXISTS;
        }
        try {
            if (Files.isDirectory(path)) {
                try (DirectoryStream<Path> entries = Files.newDirectoryStream(path)) {
                    for (Path ignored : entries) {
                        // Iterating forces the listing to actually be read.
                    }
                }
            } else {
                try (InputStream in = Files.newInputStream(path)) {
                    in.transferTo(OutputStream.nullOutputStream());
                }
            }
            return FolderAccessStatus.ACCESSIBLE;
        } catch (IOException | SecurityException e) {
            logger.log(System.Logger.Level.DEBUG, "No read access to " + path + ": " + e.getMessage());
            return FolderAccessStatus.DENIED;
        }
    }
}
