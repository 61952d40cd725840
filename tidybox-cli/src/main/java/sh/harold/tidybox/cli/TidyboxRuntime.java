package sh.harold.tidybox.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import sh.harold.tidybox.core.catalog.CleanupCatalog;
import sh.harold.tidybox.core.catalog.LeftoverSearchRoots;
import sh.harold.tidybox.core.concurrent.CancellationToken;
import sh.harold.tidybox.core.concurrent.NamedThreadFactory;
import sh.harold.tidybox.core.config.TidyboxConfig;
import sh.harold.tidybox.core.delete.DeletionCandidate;
import sh.harold.tidybox.core.delete.DeletionExecutor;
import sh.harold.tidybox.core.delete.DeletionResult;
import sh.harold.tidybox.core.delete.TrashService;
import sh.harold.tidybox.core.orphan.AppBundleRegistry;
import sh.harold.tidybox.core.orphan.InstalledApp;
import sh.harold.tidybox.core.orphan.InstalledAppRegistry;
import sh.harold.tidybox.core.orphan.KnownIdentifierStore;
import sh.harold.tidybox.core.orphan.OrphanClassifier;
import sh.harold.tidybox.core.orphan.OrphanDetector;
import sh.harold.tidybox.core.orphan.OrphanScanListener;
import sh.harold.tidybox.core.orphan.OrphanScanResult;
import sh.harold.tidybox.core.pattern.PathPatternExpander;
import sh.harold.tidybox.core.permission.AccessProbe;
import sh.harold.tidybox.core.permission.FileSystemAccessProbe;
import sh.harold.tidybox.core.permission.PermissionCatalog;
import sh.harold.tidybox.core.permission.PermissionGroup;
import sh.harold.tidybox.core.permission.PermissionProbe;
import sh.harold.tidybox.core.permission.ProbePass;
import sh.harold.tidybox.core.safety.PathSafetyValidator;
import sh.harold.tidybox.core.safety.SafetyPolicy;
import sh.harold.tidybox.core.scan.CleanupScanResult;
import sh.harold.tidybox.core.scan.CleanupScanner;

/**
 * Wires the core components for one CLI invocation and owns the worker pool.
 */
final class TidyboxRuntime implements AutoCloseable {
    private final TidyboxConfig config;
    private final System.Logger logger;
    private final ExecutorService worker;
    private final CancellationToken session = CancellationToken.create();

    private final PathSafetyValidator validator;
    private final CleanupScanner scanner;
    private final InstalledAppRegistry registry;
    private final KnownIdentifierStore knownIdentifiers;
    private final OrphanDetector orphanDetector;
    private final PermissionCatalog permissions;
    private final PermissionProbe permissionProbe;
    private final DeletionExecutor deletionExecutor;

    private TidyboxRuntime(
        TidyboxConfig config,
        System.Logger logger,
        ExecutorService worker,
        InstalledAppRegistry registry,
        AccessProbe accessProbe,
        TrashService trash,
        Clock clock
    ) {
        this.config = config;
        this.logger = logger;
        this.worker = worker;
        this.validator = new PathSafetyValidator(SafetyPolicy.forHome(config.home()));
        this.scanner = new CleanupScanner(
            new PathPatternExpander(config.home(), logger),
            validator,
            worker,
            logger,
            config.includeRootOnly()
        );
        this.registry = registry;
        this.knownIdentifiers = new KnownIdentifierStore(config.knownIdentifiersFile(), logger);
        this.orphanDetector = new OrphanDetector(worker, logger);
        this.permissions = PermissionCatalog.defaults(config.home(), clock);
        this.permissionProbe = new PermissionProbe(permissions, accessProbe, worker, logger);
        this.deletionExecutor = new DeletionExecutor(validator, trash, logger);
    }

    static TidyboxRuntime start(TidyboxConfig config, System.Logger logger) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(logger, "logger");
        return create(
            config,
            logger,
            new AppBundleRegistry(config.applicationDirs(), logger, false),
            new FileSystemAccessProbe(logger),
            TrashService.desktopTrash(TrashService.directoryTrash(config.trashDir()))
        );
    }

    static TidyboxRuntime create(
        TidyboxConfig config,
        System.Logger logger,
        InstalledAppRegistry registry,
        AccessProbe accessProbe,
        TrashService trash
    ) {
        ExecutorService worker = Executors.newFixedThreadPool(
            config.scanThreads(),
            new NamedThreadFactory("tidybox-worker", logger)
        );
        return new TidyboxRuntime(config, logger, worker, registry, accessProbe, trash, Clock.systemUTC());
    }

    TidyboxConfig config() {
        return config;
    }

    PathSafetyValidator validator() {
        return validator;
    }

    PermissionCatalog permissions() {
        return permissions;
    }

    CancellationToken session() {
        return session;
    }

    CleanupScanResult scan() {
        return scanner.scan(CleanupCatalog.all(), session).join();
    }

    long trashSize() {
        return scanner.trashSize(config.home());
    }

    /**
     * Scans for leftovers and records the identifiers installed right now for later runs.
     */
    OrphanScanResult scanOrphans(OrphanScanListener listener) throws IOException {
        Set<String> known = knownIdentifiers.load();
        OrphanClassifier classifier = OrphanDetector.classifierFor(registry, known);
        try {
            knownIdentifiers.remember(registry.installedApps().stream().map(InstalledApp::bundleIdentifier).toList());
        } catch (IOException e) {
            logger.log(System.Logger.Level.WARNING, "Failed to update known identifiers in " + knownIdentifiers.file(), e);
        }
        return orphanDetector.scan(classifier, LeftoverSearchRoots.all(config.home()), listener, session).join();
    }

    List<PermissionGroup> probePermissions(ProbePass pass) {
        return permissionProbe.run(pass, session).join();
    }

    DeletionResult delete(List<DeletionCandidate> candidates) {
        return deletionExecutor.execute(candidates, session);
    }

    Path home() {
        return config.home();
    }

    @Override
    public void close() {
        session.cancel();
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
