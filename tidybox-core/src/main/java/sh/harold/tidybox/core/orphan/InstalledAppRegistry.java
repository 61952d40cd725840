package sh.harold.tidybox.core.orphan;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only source of installed applications.
 */
public interface InstalledAppRegistry {
    List<InstalledApp> installedApps() throws IOException;

    /**
     * Display names of installed applications. Implementations may add names of applications
     * whose identifier could not be read, so their residue is still treated as owned.
     */
    default Set<String> installedNames() throws IOException {
        Set<String> names = new LinkedHashSet<>();
        for (InstalledApp app : installedApps()) {
            names.add(app.name());
        }
        return names;
    }
}
