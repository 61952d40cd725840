package sh.harold.tidybox.core.scan;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import sh.harold.tidybox.core.catalog.CleanupCategory;

/**
 * Immutable snapshot of one cleanup scan.
 *
 * @param groups non-empty groups in category order
 * @param cancelled whether some definitions were skipped because the scan was cancelled
 */
public record CleanupScanResult(List<CleanupGroup> groups, boolean cancelled) {
    public CleanupScanResult {
        Objects.requireNonNull(groups, "groups");
        groups = List.copyOf(groups);
    }

    public long totalSize() {
        return groups.stream().mapToLong(CleanupGroup::totalSize).sum();
    }

    public List<CleanableItem> items() {
        return groups.stream().flatMap(group -> group.items().stream()).toList();
    }

    public List<CleanableItem> selectedItems() {
        return items().stream().filter(CleanableItem::selected).toList();
    }

    /**
     * Selects every item of the given categories and deselects everything else.
     */
    public CleanupScanResult selectOnly(Set<CleanupCategory> categories) {
        Objects.requireNonNull(categories, "categories");
        return new CleanupScanResult(
            groups.stream().map(group -> group.withAllSelected(categories.contains(group.category()))).toList(),
            cancelled
        );
    }
}
