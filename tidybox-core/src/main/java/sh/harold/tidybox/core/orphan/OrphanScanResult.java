package sh.harold.tidybox.core.orphan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import sh.harold.tidybox.core.catalog.LeftoverCategory;

/**
 * Complete outcome of one orphan scan, largest leftovers first.
 */
public record OrphanScanResult(List<LeftoverFile> leftovers, boolean cancelled) {
    static final Comparator<LeftoverFile> LARGEST_FIRST = Comparator
        .comparingLong(LeftoverFile::sizeBytes).reversed()
        .thenComparing(file -> file.path().toString());

    public OrphanScanResult {
        Objects.requireNonNull(leftovers, "leftovers");
        List<LeftoverFile> sorted = new ArrayList<>(leftovers);
        sorted.sort(LARGEST_FIRST);
        leftovers = List.copyOf(sorted);
    }

    public long totalSize() {
        long total = 0L;
        for (LeftoverFile leftover : leftovers) {
            total += leftover.sizeBytes();
        }
        return total;
    }

    public List<LeftoverFile> atLeast(Confidence minimum) {
        Objects.requireNonNull(minimum, "minimum");
        return leftovers.stream()
            .filter(leftover -> leftover.confidence().isAtLeast(minimum))
            .toList();
    }

    public Map<LeftoverCategory, List<LeftoverFile>> byCategory() {
        Map<LeftoverCategory, List<LeftoverFile>> grouped = new EnumMap<>(LeftoverCategory.class);
        for (LeftoverFile leftover : leftovers) {
            grouped.computeIfAbsent(leftover.category(), ignored -> new ArrayList<>()).add(leftover);
        }
        grouped.replaceAll((category, files) -> List.copyOf(files));
        return grouped;
    }
}
