package sh.harold.tidybox.core.scan;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import sh.harold.tidybox.core.catalog.CleanupCategory;
import sh.harold.tidybox.core.catalog.CleanupPathDefinition;
import sh.harold.tidybox.core.concurrent.CancellationToken;
import sh.harold.tidybox.core.fs.PathSizeException;
import sh.harold.tidybox.core.fs.PathSizes;
import sh.harold.tidybox.core.pattern.PathPatternExpander;
import sh.harold.tidybox.core.safety.PathSafetyValidator;
import sh.harold.tidybox.core.safety.ValidationResult;

/**
 * Expands cleanup definitions into sized, validated items.
 *
 * <p>Each definition is one unit of work on the executor. When a path is produced both by a
 * broad definition and, through its children, by a narrower one, the narrower items win and the
 * broad item is dropped so nothing is counted twice.
 */
public final class CleanupScanner {
    private final PathPatternExpander expander;
    private final PathSafetyValidator validator;
    private final Executor executor;
    private final System.Logger logger;
    private final boolean includeRootOnly;

    public CleanupScanner(
        PathPatternExpander expander,
        PathSafetyValidator validator,
        Executor executor,
        System.Logger logger,
        boolean includeRootOnly
    ) {
        this.expander = Objects.requireNonNull(expander, "expander");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.includeRootOnly = includeRootOnly;
    }

    public CompletableFuture<CleanupScanResult> scan(
        List<CleanupPathDefinition> definitions,
        CancellationToken token
    ) {
        Objects.requireNonNull(definitions, "definitions");
        Objects.requireNonNull(token, "token");

        List<CompletableFuture<List<CleanableItem>>> units = new ArrayList<>(definitions.size());
        for (CleanupPathDefinition definition : definitions) {
            units.add(CompletableFuture.supplyAsync(() -> scanDefinition(definition, token), executor));
        }
        return CompletableFuture.allOf(units.toArray(CompletableFuture[]::new))
            .thenApply(ignored -> {
                List<CleanableItem> items = new ArrayList<>();
                for (CompletableFuture<List<CleanableItem>> unit : units) {
                    items.addAll(unit.join());
                }
                return new CleanupScanResult(group(dropShadowed(items)), token.isCancelled());
            });
    }

    /**
     * Size of the user trash, or {@code 0} when it cannot be read.
     */
    public long trashSize(Path home) {
        return PathSizes.sizeOrZero(home.resolve(".Trash"), logger);
    }

    private List<CleanableItem> scanDefinition(CleanupPathDefinition definition, CancellationToken token) {
        if (token.isCancelled()) {
            return List.of();
        }
        if (definition.requiresRoot() && !includeRootOnly) {
            logger.log(System.Logger.Level.DEBUG, "Skipping root-only pattern " + definition.pattern());
            return List.of();
        }

        List<CleanableItem> items = new ArrayList<>();
        for (Path path : expander.expand(definition)) {
            ValidationResult verdict = validator.validate(path);
            if (!verdict.isSafe()) {
                logger.log(System.Logger.Level.DEBUG, "Not offering " + path + ": " + verdict.reason());
                continue;
            }
            long size;
            try {
                size = PathSizes.sizeOf(path);
            } catch (PathSizeException e) {
                if (e.reason() == PathSizeException.Reason.NOT_FOUND) {
                    continue;
                }
                logger.log(System.Logger.Level.DEBUG, e.getMessage());
                size = 0L;
            }
            items.add(CleanableItem.of(path, size, definition.category(), definition.safeToClean()));
        }
        return items;
    }

    /**
     * Drops duplicates and any item that has another item beneath it.
     */
    private static List<CleanableItem> dropShadowed(List<CleanableItem> items) {
        Map<Path, CleanableItem> byPath = new LinkedHashMap<>();
        for (CleanableItem item : items) {
            byPath.putIfAbsent(item.path(), item);
        }
        NavigableSet<String> paths = new TreeSet<>();
        for (Path path : byPath.keySet()) {
            paths.add(path.toString());
        }
        List<CleanableItem> kept = new ArrayList<>(byPath.size());
        for (CleanableItem item : byPath.values()) {
            // The first entry at or after "<path>/" is a descendant whenever one exists.
            String prefix = item.path().toString() + item.path().getFileSystem().getSeparator();
            String next = paths.ceiling(prefix);
            if (next == null || !next.startsWith(prefix)) {
                kept.add(item);
            }
        }
        return kept;
    }

    private static List<CleanupGroup> group(List<CleanableItem> items) {
        Map<CleanupCategory, List<CleanableItem>> byCategory = new EnumMap<>(CleanupCategory.class);
        for (CleanableItem item : items) {
            byCategory.computeIfAbsent(item.category(), ignored -> new ArrayList<>()).add(item);
        }
        List<CleanupGroup> groups = new ArrayList<>(byCategory.size());
        for (Map.Entry<CleanupCategory, List<CleanableItem>> entry : byCategory.entrySet()) {
            List<CleanableItem> sorted = new ArrayList<>(entry.getValue());
            sorted.sort(Comparator.comparingLong(CleanableItem::sizeBytes).reversed()
                .thenComparing(item -> item.path().toString()));
            groups.add(new CleanupGroup(entry.getKey(), sorted));
        }
        return groups;
    }
}
