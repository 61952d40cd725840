package sh.harold.tidybox.core.scan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sh.harold.tidybox.core.catalog.CleanupCatalog;
import sh.harold.tidybox.core.catalog.CleanupCategory;
import sh.harold.tidybox.core.catalog.CleanupPathDefinition;
import sh.harold.tidybox.core.concurrent.CancellationToken;
import sh.harold.tidybox.core.pattern.PathPatternExpander;
import sh.harold.tidybox.core.safety.PathSafetyValidator;
import sh.harold.tidybox.core.safety.SafetyPolicy;

class CleanupScannerTest {
    private static final System.Logger LOGGER = System.getLogger("scanner-test");
    private static final Executor DIRECT = Runnable::run;

    @Test
    void scan_groupsSizedItemsByCategory(@TempDir Path home) throws IOException {
        Path caches = Files.createDirectories(home.resolve("Library/Caches"));
        Files.createDirectory(caches.resolve("com.a.App"));
        Files.write(caches.resolve("com.a.App/blob"), new byte[100]);
        Files.createDirectory(caches.resolve("Homebrew"));
        Files.write(caches.resolve("Homebrew/pkg.tar"), new byte[500]);
        Path trash = Files.createDirectories(home.resolve(".Trash"));
        Files.write(trash.resolve("old.zip"), new byte[50]);
        Path archives = Files.createDirectories(home.resolve("Library/Developer/Xcode/Archives/2024-01-01"));
        Files.write(archives.resolve("App.xcarchive"), new byte[70]);

        CleanupScanResult result = scanner(home).scan(CleanupCatalog.all(), CancellationToken.none()).join();

        assertFalse(result.cancelled());
        assertEquals(
            List.of(CleanupCategory.USER_CACHES, CleanupCategory.TRASH, CleanupCategory.XCODE_ARCHIVES, CleanupCategory.HOMEBREW),
            result.groups().stream().map(CleanupGroup::category).toList()
        );
        assertEquals(720L, result.totalSize());
        assertEquals(600L, result.selectedItems().stream().mapToLong(CleanableItem::sizeBytes).sum());

        CleanupGroup homebrew = result.groups().get(3);
        assertEquals(List.of(caches.resolve("Homebrew/pkg.tar")), homebrew.items().stream().map(CleanableItem::path).toList());
        assertTrue(result.items().stream().noneMatch(item -> item.path().equals(caches.resolve("Homebrew"))));

        CleanupGroup archiveGroup = result.groups().get(2);
        assertEquals(0, archiveGroup.selectedCount());
        assertEquals(0, result.groups().get(1).selectedCount());
    }

    @Test
    void scan_dropsParentsOfDeeperItemsButKeepsSiblingsSharingAPrefix(@TempDir Path home) throws IOException {
        Path caches = Files.createDirectories(home.resolve("Library/Caches"));
        Files.createDirectory(caches.resolve("Homebrew"));
        Files.write(caches.resolve("Homebrew/pkg.tar"), new byte[30]);
        Files.createDirectory(caches.resolve("Homebrew-old"));
        Files.write(caches.resolve("Homebrew-old/leftover"), new byte[20]);
        Files.write(caches.resolve("Homebrew.db"), new byte[10]);

        CleanupScanResult result = scanner(home).scan(CleanupCatalog.all(), CancellationToken.none()).join();

        List<Path> paths = result.items().stream().map(CleanableItem::path).sorted().toList();
        assertEquals(
            List.of(caches.resolve("Homebrew-old"), caches.resolve("Homebrew.db"), caches.resolve("Homebrew/pkg.tar")),
            paths
        );
    }

    @Test
    void scan_itemIdsAreStableAcrossRescans(@TempDir Path home) throws IOException {
        Path caches = Files.createDirectories(home.resolve("Library/Caches"));
        Files.write(caches.resolve("a.db"), new byte[10]);
        Files.write(caches.resolve("b.db"), new byte[20]);
        CleanupScanner scanner = scanner(home);
        List<CleanupPathDefinition> definitions = CleanupCatalog.forCategory(CleanupCategory.USER_CACHES);

        List<CleanableItem> first = scanner.scan(definitions, CancellationToken.none()).join().items();
        List<CleanableItem> second = scanner.scan(definitions, CancellationToken.none()).join().items();

        assertEquals(first.stream().map(CleanableItem::id).toList(), second.stream().map(CleanableItem::id).toList());
        assertEquals(List.of(caches.resolve("b.db"), caches.resolve("a.db")), first.stream().map(CleanableItem::path).toList());
    }

    @Test
    void scan_skipsRootOnlyDefinitionsByDefault(@TempDir Path home) throws IOException {
        Path logs = Files.createDirectories(home.resolve("Library/Logs"));
        Files.write(logs.resolve("vendor.log"), new byte[5]);
        List<CleanupPathDefinition> definitions = List.of(
            new CleanupPathDefinition("~/Library/Logs/*", CleanupCategory.LOGS, "root only", true, true)
        );

        assertTrue(scanner(home).scan(definitions, CancellationToken.none()).join().groups().isEmpty());
    }

    @Test
    void scan_cancelledBeforeStart_returnsEmptyCancelledResult(@TempDir Path home) throws IOException {
        Files.createDirectories(home.resolve("Library/Caches/com.a.App"));
        CancellationToken token = CancellationToken.create();
        token.cancel();

        CleanupScanResult result = scanner(home).scan(CleanupCatalog.all(), token).join();

        assertTrue(result.cancelled());
        assertTrue(result.groups().isEmpty());
    }

    @Test
    void selectOnly_selectsWholeCategoriesAndClearsOthers(@TempDir Path home) throws IOException {
        Path caches = Files.createDirectories(home.resolve("Library/Caches"));
        Files.write(caches.resolve("a.db"), new byte[10]);
        Path trash = Files.createDirectories(home.resolve(".Trash"));
        Files.write(trash.resolve("old.zip"), new byte[50]);

        CleanupScanResult result = scanner(home).scan(CleanupCatalog.all(), CancellationToken.none()).join()
            .selectOnly(Set.of(CleanupCategory.USER_CACHES));

        assertEquals(List.of(caches.resolve("a.db")), result.selectedItems().stream().map(CleanableItem::path).toList());
        assertEquals(50L, scanner(home).trashSize(home));
    }

    private static CleanupScanner scanner(Path home) {
        return new CleanupScanner(
            new PathPatternExpander(home, LOGGER),
            new PathSafetyValidator(SafetyPolicy.forHome(home)),
            DIRECT,
            LOGGER,
            false
        );
    }
}
