package sh.harold.tidybox.core.orphan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Stream;
import sh.harold.tidybox.core.catalog.LeftoverSearchRoot;
import sh.harold.tidybox.core.concurrent.CancellationToken;
import sh.harold.tidybox.core.fs.PathSizes;

/**
 * Scans library roots for residue of applications that are no longer installed.
 */
public final class OrphanDetector {
    private final Executor executor;
    private final System.Logger logger;
    private final Object listenerLock = new Object();

    public OrphanDetector(Executor executor, System.Logger logger) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * Builds a classifier from an installed-app snapshot plus identifiers remembered from earlier runs.
     */
    public static OrphanClassifier classifierFor(InstalledAppRegistry registry, Set<String> knownIdentifiers)
        throws IOException {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(knownIdentifiers, "knownIdentifiers");
        Set<String> identifiers = new TreeSet<>();
        for (InstalledApp app : registry.installedApps()) {
            identifiers.add(app.bundleIdentifier());
        }
        return new OrphanClassifier(identifiers, registry.installedNames(), knownIdentifiers);
    }

    public CompletableFuture<OrphanScanResult> scan(
        OrphanClassifier classifier,
        List<LeftoverSearchRoot> roots,
        OrphanScanListener listener,
        CancellationToken token
    ) {
        Objects.requireNonNull(classifier, "classifier");
        Objects.requireNonNull(roots, "roots");
        Objects.requireNonNull(listener, "listener");
        Objects.requireNonNull(token, "token");

        List<CompletableFuture<List<LeftoverFile>>> units = new ArrayList<>(roots.size());
        for (LeftoverSearchRoot root : roots) {
            units.add(CompletableFuture.supplyAsync(() -> {
                if (token.isCancelled()) {
                    return List.<LeftoverFile>of();
                }
                List<LeftoverFile> found = scanRoot(classifier, root);
                publish(listener, root, found);
                return found;
            }, executor));
        }
        return CompletableFuture.allOf(units.toArray(CompletableFuture[]::new))
            .thenApply(ignored -> {
                List<LeftoverFile> all = new ArrayList<>();
                for (CompletableFuture<List<LeftoverFile>> unit : units) {
                    all.addAll(unit.join());
                }
                OrphanScanResult result = new OrphanScanResult(all, token.isCancelled());
                logger.log(System.Logger.Level.INFO, "Orphan scan found " + result.leftovers().size()
                    + " leftovers (" + result.totalSize() + " bytes)");
                return result;
            });
    }

    List<LeftoverFile> scanRoot(OrphanClassifier classifier, LeftoverSearchRoot root) {
        Path dir = root.path();
        if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
            return List.of();
        }
        List<Path> entries;
        try (Stream<Path> stream = Files.list(dir)) {
            entries = stream.sorted().toList();
        } catch (IOException | SecurityException e) {
            logger.log(System.Logger.Level.DEBUG, "Cannot enumerate " + dir + ": " + e.getMessage());
            return List.of();
        }

        List<LeftoverFile> found = new ArrayList<>();
        for (Path entry : entries) {
            String name = entry.getFileName().toString();
            if (name.startsWith(".")) {
                continue;
            }
            Classification classification = classifier.classify(name);
            if (!classification.isOrphan()) {
                continue;
            }
            found.add(new LeftoverFile(
                entry,
                PathSizes.sizeOrZero(entry, logger),
                root.category(),
                classification.confidence().orElseThrow(),
                classification.relatedIdentifier(),
                lastModified(entry)
            ));
        }
        return List.copyOf(found);
    }

    private void publish(OrphanScanListener listener, LeftoverSearchRoot root, List<LeftoverFile> found) {
        synchronized (listenerLock) {
            try {
                listener.onRootCompleted(root, found);
            } catch (RuntimeException e) {
                logger.log(System.Logger.Level.WARNING, "Orphan scan listener failed for " + root.path(), e);
            }
        }
    }

    private Instant lastModified(Path entry) {
        try {
            return Files.getLastModifiedTime(entry, LinkOption.NOFOLLOW_LINKS).toInstant();
        } catch (IOException e) {
            logger.log(System.Logger.Level.DEBUG, "No modification time for " + entry);
            return null;
        }
    }
}
