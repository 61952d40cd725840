package sh.harold.tidybox.core.fs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathSizesTest {

    @Test
    void sizeOf_directory_sumsNestedFiles(@TempDir Path tempDir) throws IOException {
        Path root = Files.createDirectories(tempDir.resolve("cache"));
        Path nested = Files.createDirectories(root.resolve("a/b"));
        Files.write(root.resolve("top.bin"), new byte[100]);
        Files.write(root.resolve("a/mid.bin"), new byte[250]);
        Files.write(nested.resolve("deep.bin"), new byte[4096]);

        assertEquals(4446L, PathSizes.sizeOf(root));
    }

    @Test
    void sizeOf_file_isItsLength(@TempDir Path tempDir) throws IOException {
        Path file = Files.write(tempDir.resolve("one.log"), new byte[321]);

        assertEquals(321L, PathSizes.sizeOf(file));
    }

    @Test
    void sizeOf_symlinks_areNotFollowed(@TempDir Path tempDir) throws IOException {
        Path outside = Files.createDirectories(tempDir.resolve("outside"));
        Files.write(outside.resolve("big.bin"), new byte[10_000]);
        Path root = Files.createDirectories(tempDir.resolve("cache"));
        Files.write(root.resolve("small.bin"), new byte[10]);
        Files.createSymbolicLink(root.resolve("link"), outside);

        assertEquals(10L, PathSizes.sizeOf(root));
        assertEquals(0L, PathSizes.sizeOf(root.resolve("link")));
    }

    @Test
    void sizeOf_missing_reportsNotFound(@TempDir Path tempDir) {
        PathSizeException e = assertThrows(PathSizeException.class, () -> PathSizes.sizeOf(tempDir.resolve("gone")));

        assertEquals(PathSizeException.Reason.NOT_FOUND, e.reason());
        assertEquals(0L, PathSizes.sizeOrZero(tempDir.resolve("gone"), System.getLogger("sizes-test")));
    }
}
