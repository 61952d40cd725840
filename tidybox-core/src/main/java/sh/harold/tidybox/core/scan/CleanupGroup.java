package sh.harold.tidybox.core.scan;

import java.util.List;
import java.util.Objects;
import sh.harold.tidybox.core.catalog.CleanupCategory;

/**
 * Items of one category, largest first.
 */
public record CleanupGroup(CleanupCategory category, List<CleanableItem> items) {
    public CleanupGroup {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(items, "items");
        items = List.copyOf(items);
    }

    public long totalSize() {
        return items.stream().mapToLong(CleanableItem::sizeBytes).sum();
    }

    public long selectedSize() {
        return items.stream().filter(CleanableItem::selected).mapToLong(CleanableItem::sizeBytes).sum();
    }

    public int selectedCount() {
        return (int) items.stream().filter(CleanableItem::selected).count();
    }

    public CleanupGroup withAllSelected(boolean selected) {
        return new CleanupGroup(category, items.stream().map(item -> item.withSelected(selected)).toList());
    }
}
