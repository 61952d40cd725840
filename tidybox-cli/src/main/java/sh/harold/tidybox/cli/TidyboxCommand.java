package sh.harold.tidybox.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import sh.harold.tidybox.core.catalog.CleanupCategory;
import sh.harold.tidybox.core.catalog.LeftoverCategory;
import sh.harold.tidybox.core.delete.DeletionCandidate;
import sh.harold.tidybox.core.delete.DeletionError;
import sh.harold.tidybox.core.delete.DeletionResult;
import sh.harold.tidybox.core.orphan.Confidence;
import sh.harold.tidybox.core.orphan.LeftoverFile;
import sh.harold.tidybox.core.orphan.OrphanScanListener;
import sh.harold.tidybox.core.orphan.OrphanScanResult;
import sh.harold.tidybox.core.permission.FolderAccessInfo;
import sh.harold.tidybox.core.permission.PermissionGroup;
import sh.harold.tidybox.core.permission.ProbePass;
import sh.harold.tidybox.core.safety.ValidationResult;
import sh.harold.tidybox.core.scan.CleanableItem;
import sh.harold.tidybox.core.scan.CleanupGroup;
import sh.harold.tidybox.core.scan.CleanupScanResult;

/**
 * The {@code tidybox} subcommands. Each returns a process exit code.
 */
final class TidyboxCommand {
    static final int OK = 0;
    static final int FAILED = 1;

    private final TidyboxRuntime runtime;
    private final PrintWriter out;

    TidyboxCommand(TidyboxRuntime runtime, PrintWriter out) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.out = Objects.requireNonNull(out, "out");
    }

    int scan() {
        CleanupScanResult result = runtime.scan();
        for (CleanupGroup group : result.groups()) {
            out.println(group.category().displayName() + ": " + formatBytes(group.totalSize())
                + " (" + group.items().size() + " items, " + group.selectedCount() + " selected)");
            for (CleanableItem item : group.items()) {
                out.println("  " + (item.selected() ? "[x] " : "[ ] ") + item.path() + "  " + formatBytes(item.sizeBytes()));
            }
        }
        out.println("Total: " + formatBytes(result.totalSize()));
        out.println("Trash: " + formatBytes(runtime.trashSize()));
        return OK;
    }

    int orphans() {
        OrphanScanResult result;
        try {
            result = runtime.scanOrphans(OrphanScanListener.none());
        } catch (IOException e) {
            out.println("Could not read installed applications: " + e.getMessage());
            return FAILED;
        }
        for (Map.Entry<LeftoverCategory, List<LeftoverFile>> entry : result.byCategory().entrySet()) {
            out.println(entry.getKey().displayName() + ":");
            for (LeftoverFile leftover : entry.getValue()) {
                out.println("  " + leftover.confidence() + "  " + leftover.path() + "  " + formatBytes(leftover.sizeBytes())
                    + leftover.related().map(related -> "  (" + related + ")").orElse(""));
            }
        }
        out.println("Leftovers: " + result.leftovers().size() + ", " + formatBytes(result.totalSize()));
        return OK;
    }

    int permissions(boolean full) {
        List<PermissionGroup> groups = runtime.probePermissions(full ? ProbePass.FULL : ProbePass.STARTUP);
        for (PermissionGroup group : groups) {
            out.println(group.type().displayName() + ": " + group.overallStatus().label() + " (" + group.summary() + ")");
            for (FolderAccessInfo folder : group.folders()) {
                out.println("  " + folder.displayName() + "  " + folder.status().label() + "  " + folder.path());
            }
        }
        out.println("Full disk access: " + runtime.permissions().elevatedAccessStatus().label());
        return OK;
    }

    int validate(List<String> paths) {
        if (paths.isEmpty()) {
            out.println("validate needs at least one path");
            return FAILED;
        }
        boolean allSafe = true;
        for (String path : paths) {
            ValidationResult result = runtime.validator().validate(path);
            out.println(result.outcome() + "  " + path + "  " + result.reason());
            allSafe &= result.isSafe();
        }
        return allSafe ? OK : FAILED;
    }

    int clean(Set<CleanupCategory> categories, boolean orphans, Confidence minConfidence, boolean confirmed) {
        Objects.requireNonNull(categories, "categories");
        Objects.requireNonNull(minConfidence, "minConfidence");

        List<DeletionCandidate> candidates = new ArrayList<>();
        if (orphans) {
            try {
                for (LeftoverFile leftover : runtime.scanOrphans(OrphanScanListener.none()).atLeast(minConfidence)) {
                    candidates.add(DeletionCandidate.of(leftover));
                }
            } catch (IOException e) {
                out.println("Could not read installed applications: " + e.getMessage());
                return FAILED;
            }
        } else {
            CleanupScanResult scanned = runtime.scan();
            CleanupScanResult selection = categories.isEmpty() ? scanned : scanned.selectOnly(categories);
            for (CleanableItem item : selection.selectedItems()) {
                candidates.add(DeletionCandidate.of(item));
            }
        }

        long total = candidates.stream().mapToLong(DeletionCandidate::sizeBytes).sum();
        if (!confirmed) {
            for (DeletionCandidate candidate : candidates) {
                out.println("  would remove " + candidate.path() + "  " + formatBytes(candidate.sizeBytes()));
            }
            out.println("Dry run: " + candidates.size() + " items, " + formatBytes(total) + ". Pass --yes to move them to the trash.");
            return OK;
        }

        DeletionResult result = runtime.delete(candidates);
        out.println("Removed " + result.successCount() + " items, freed " + formatBytes(result.freedBytes()));
        for (DeletionError error : result.errors()) {
            out.println("  failed " + error.path() + ": " + error.kind() + " (" + error.reason() + ")");
        }
        return result.hasFailures() ? FAILED : OK;
    }

    static String formatBytes(long bytes) {
        if (bytes < 1024L) {
            return bytes + " B";
        }
        String[] units = {"KB", "MB", "GB", "TB"};
        double value = bytes;
        int unit = -1;
        while (value >= 1024.0 && unit < units.length - 1) {
            value /= 1024.0;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", value, units[unit]);
    }
}
