package sh.harold.tidybox.core.fs;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;

/**
 * Computes on-disk sizes of files and directory trees.
 *
 * <p>Symbolic links are never followed and contribute zero bytes, both for the path itself and
 * for anything reached while walking a directory. Descendants that cannot be read are skipped;
 * only a failure to stat the path itself or to open the top-level directory is reported.
 */
public final class PathSizes {
    private PathSizes() {
    }

    public static long sizeOf(Path path) throws PathSizeException {
        Objects.requireNonNull(path, "path");
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        } catch (NoSuchFileException e) {
            throw new PathSizeException(path, PathSizeException.Reason.NOT_FOUND, e);
        } catch (IOException e) {
            throw new PathSizeException(path, PathSizeException.Reason.STAT_FAILED, e);
        }
        if (attrs.isSymbolicLink()) {
            return 0L;
        }
        if (!attrs.isDirectory()) {
            return Math.max(0L, attrs.size());
        }
        return directorySize(path);
    }

    /**
     * Same as {@link #sizeOf(Path)} but returns {@code 0} when the size cannot be determined.
     */
    public static long sizeOrZero(Path path, System.Logger logger) {
        try {
            return sizeOf(path);
        } catch (PathSizeException e) {
            logger.log(System.Logger.Level.DEBUG, e.getMessage());
            return 0L;
        }
    }

    private static long directorySize(Path dir) throws PathSizeException {
        SizeVisitor visitor = new SizeVisitor(dir);
        try {
            Files.walkFileTree(dir, visitor);
        } catch (IOException e) {
            throw new PathSizeException(dir, PathSizeException.Reason.ENUMERATION_FAILED, e);
        }
        return visitor.total;
    }

    private static final class SizeVisitor extends SimpleFileVisitor<Path> {
        private final Path root;
        private long total;

        private SizeVisitor(Path root) {
            this.root = root;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile()) {
                total += Math.max(0L, attrs.size());
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (file.equals(root)) {
                throw exc;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
            if (exc != null && dir.equals(root)) {
                throw exc;
            }
            return FileVisitResult.CONTINUE;
        }
    }
}
