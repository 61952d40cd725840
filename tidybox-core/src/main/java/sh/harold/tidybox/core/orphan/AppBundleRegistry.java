package sh.harold.tidybox.core.orphan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;
import sh.harold.tidybox.core.fs.PathSizes;

/**
 * Finds {@code .app} bundles in application directories and reads their {@code Info.plist}.
 */
public final class AppBundleRegistry implements InstalledAppRegistry {
    private static final String APP_SUFFIX = ".app";

    private final List<Path> applicationDirs;
    private final System.Logger logger;
    private final boolean measureSizes;

    public AppBundleRegistry(List<Path> applicationDirs, System.Logger logger, boolean measureSizes) {
        Objects.requireNonNull(applicationDirs, "applicationDirs");
        this.applicationDirs = List.copyOf(applicationDirs);
        this.logger = Objects.requireNonNull(logger, "logger");
        this.measureSizes = measureSizes;
    }

    @Override
    public List<InstalledApp> installedApps() {
        List<InstalledApp> apps = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Path bundle : bundles()) {
            InstalledApp app = readBundle(bundle);
            if (app != null && seen.add(app.bundleIdentifier())) {
                apps.add(app);
            }
        }
        return List.copyOf(apps);
    }

    /**
     * Includes the bundle directory name of every app, also those whose identifier is unreadable.
     */
    @Override
    public Set<String> installedNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Path bundle : bundles()) {
            names.add(displayNameOf(bundle));
        }
        for (InstalledApp app : installedApps()) {
            names.add(app.name());
        }
        return names;
    }

    private List<Path> bundles() {
        List<Path> bundles = new ArrayList<>();
        for (Path dir : applicationDirs) {
            if (!Files.isDirectory(dir)) {
                continue;
            }
            try (Stream<Path> stream = Files.list(dir)) {
                stream
                    .filter(path -> path.getFileName().toString().endsWith(APP_SUFFIX))
                    .filter(Files::isDirectory)
                    .sorted()
                    .forEach(bundles::add);
            } catch (IOException e) {
                logger.log(System.Logger.Level.WARNING, "Failed to list applications in " + dir, e);
            }
        }
        return bundles;
    }

    private InstalledApp readBundle(Path bundle) {
        Path plist = bundle.resolve("Contents").resolve("Info.plist");
        if (!Files.isRegularFile(plist)) {
            logger.log(System.Logger.Level.DEBUG, "No Info.plist in " + bundle);
            return null;
        }
        InfoPlist info;
        try {
            info = InfoPlist.read(plist);
        } catch (IOException e) {
            logger.log(System.Logger.Level.DEBUG, "Cannot read " + plist + ": " + e.getMessage());
            return null;
        }
        String identifier = info.string("CFBundleIdentifier").orElse(null);
        if (identifier == null) {
            return null;
        }
        String name = info.string("CFBundleDisplayName")
            .or(() -> info.string("CFBundleName"))
            .orElse(displayNameOf(bundle));
        String version = info.string("CFBundleShortVersionString")
            .or(() -> info.string("CFBundleVersion"))
            .orElse(null);
        long size = measureSizes ? PathSizes.sizeOrZero(bundle, logger) : 0L;
        return InstalledApp.of(name, identifier, bundle, version, size);
    }

    private static String displayNameOf(Path bundle) {
        String fileName = bundle.getFileName().toString();
        return fileName.substring(0, fileName.length() - APP_SUFFIX.length());
    }
}
