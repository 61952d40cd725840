package sh.harold.tidybox.core.orphan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KnownIdentifierStoreTest {
    private static final System.Logger LOGGER = System.getLogger("known-test");

    @Test
    void load_missingFile_isEmpty(@TempDir Path tempDir) {
        KnownIdentifierStore store = new KnownIdentifierStore(tempDir.resolve("known.txt"), LOGGER);

        assertTrue(store.load().isEmpty());
    }

    @Test
    void remember_mergesWithExistingEntries(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("state/known.txt");
        KnownIdentifierStore store = new KnownIdentifierStore(file, LOGGER);

        store.remember(List.of("com.oldsoft.Painter", "com.acme.Editor"));
        Set<String> merged = store.remember(List.of("com.acme.Editor", " org.videolan.vlc ", ""));

        assertEquals(Set.of("com.oldsoft.Painter", "com.acme.Editor", "org.videolan.vlc"), merged);
        assertEquals(merged, store.load());
    }

    @Test
    void load_skipsCommentsAndBlankLines(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("known.txt");
        Files.writeString(file, "# seen before\n\ncom.acme.Editor\n  net.vendor.Tool  \n", StandardCharsets.UTF_8);

        assertEquals(Set.of("com.acme.Editor", "net.vendor.Tool"), new KnownIdentifierStore(file, LOGGER).load());
    }
}
