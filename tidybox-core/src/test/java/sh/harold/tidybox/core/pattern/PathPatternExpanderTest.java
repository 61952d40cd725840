package sh.harold.tidybox.core.pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sh.harold.tidybox.core.catalog.CleanupCategory;
import sh.harold.tidybox.core.catalog.CleanupPathDefinition;

class PathPatternExpanderTest {
    private static final System.Logger LOGGER = System.getLogger("expander-test");

    @Test
    void expand_withoutWildcard_returnsPathOnlyWhenItExists(@TempDir Path home) throws IOException {
        Files.createDirectories(home.resolve("Library/Caches"));
        PathPatternExpander expander = new PathPatternExpander(home, LOGGER);

        assertEquals(List.of(home.resolve("Library/Caches")), expander.expand("~/Library/Caches"));
        assertTrue(expander.expand("~/Library/Logs").isEmpty());
    }

    @Test
    void expand_wildcard_listsChildrenSorted(@TempDir Path home) throws IOException {
        Path caches = Files.createDirectories(home.resolve("Library/Caches"));
        Files.createDirectory(caches.resolve("com.b.App"));
        Files.createDirectory(caches.resolve("com.a.App"));
        Files.writeString(caches.resolve("loose.db"), "x");
        PathPatternExpander expander = new PathPatternExpander(home, LOGGER);

        List<Path> expanded = expander.expand(CleanupPathDefinition.user(
            "~/Library/Caches/*",
            CleanupCategory.USER_CACHES,
            "caches"
        ));

        assertEquals(List.of(caches.resolve("com.a.App"), caches.resolve("com.b.App"), caches.resolve("loose.db")), expanded);
    }

    @Test
    void expand_wildcardBeforeFixedSegment_returnsChildrenVerbatim(@TempDir Path home) throws IOException {
        Path caskroom = Files.createDirectories(home.resolve("Caskroom"));
        Files.createDirectories(caskroom.resolve("firefox/.metadata"));
        Files.createDirectory(caskroom.resolve("slack"));
        PathPatternExpander expander = new PathPatternExpander(home, LOGGER);

        List<Path> expanded = expander.expand("~/Caskroom/*/.metadata");

        assertEquals(List.of(caskroom.resolve("firefox"), caskroom.resolve("slack")), expanded);
    }

    @Test
    void expand_missingPrefix_isEmpty(@TempDir Path home) {
        PathPatternExpander expander = new PathPatternExpander(home, LOGGER);

        assertTrue(expander.expand("~/Library/Nowhere/*").isEmpty());
        assertTrue(expander.expand("*").isEmpty());
    }

    @Test
    void expandHome_replacesLeadingTokenOnly(@TempDir Path home) {
        PathPatternExpander expander = new PathPatternExpander(home, LOGGER);

        assertEquals(home.toString(), expander.expandHome("~"));
        assertEquals(home + "/.npm", expander.expandHome("~/.npm"));
        assertEquals("/opt/~cache", expander.expandHome("/opt/~cache"));
        assertEquals("~other/x", expander.expandHome("~other/x"));
    }
}
