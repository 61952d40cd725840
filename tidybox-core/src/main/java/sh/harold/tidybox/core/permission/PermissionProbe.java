package sh.harold.tidybox.core.permission;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import sh.harold.tidybox.core.concurrent.CancellationToken;

/**
 * Refreshes the {@link PermissionCatalog} by actually attempting to read each folder.
 *
 * <p>Every folder a run targets is marked checking before the first probe starts. Folders whose
 * probe is skipped because the run was cancelled get their previous status back.
 */
public final class PermissionProbe {
    private final PermissionCatalog catalog;
    private final AccessProbe probe;
    private final Executor executor;
    private final System.Logger logger;

    public PermissionProbe(PermissionCatalog catalog, AccessProbe probe, Executor executor, System.Logger logger) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public CompletableFuture<List<PermissionGroup>> run(ProbePass pass, CancellationToken token) {
        Objects.requireNonNull(pass, "pass");
        Objects.requireNonNull(token, "token");
        List<Path> targets = catalog.folders().stream()
            .filter(pass::includes)
            .map(FolderAccessInfo::path)
            .toList();
        return probeAll(targets, token).thenApply(groups -> {
            logger.log(System.Logger.Level.INFO, pass + " permission pass checked " + targets.size() + " folders");
            return groups;
        });
    }

    /**
     * Probes one folder on explicit request, even if reading it may raise a consent prompt.
     */
    public CompletableFuture<FolderAccessInfo> request(Path path, CancellationToken token) {
        Objects.requireNonNull(path, "path");
        return probeAll(List.of(path), token)
            .thenApply(ignored -> catalog.folder(path).orElseThrow());
    }

    private CompletableFuture<List<PermissionGroup>> probeAll(List<Path> targets, CancellationToken token) {
        Map<Path, FolderAccessStatus> previous = catalog.markChecking(targets);
        List<CompletableFuture<Void>> units = new ArrayList<>(targets.size());
        for (Path target : targets) {
            units.add(CompletableFuture.runAsync(() -> {
                if (token.isCancelled()) {
                    catalog.apply(target, previous.get(target));
                    return;
                }
                FolderAccessStatus status;
                try {
                    status = probe.probe(target);
                } catch (RuntimeException e) {
                    logger.log(System.Logger.Level.WARNING, "Access probe failed for " + target, e);
                    status = FolderAccessStatus.DENIED;
                }
                catalog.apply(target, status);
            }, executor));
        }
        return CompletableFuture.allOf(units.toArray(CompletableFuture[]::new))
            .thenApply(ignored -> {
                if (!token.isCancelled()) {
                    catalog.markChecked();
                }
                return catalog.snapshot();
            });
    }
}
