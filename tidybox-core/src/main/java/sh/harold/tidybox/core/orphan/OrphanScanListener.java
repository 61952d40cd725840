package sh.harold.tidybox.core.orphan;

import java.util.List;
import sh.harold.tidybox.core.catalog.LeftoverSearchRoot;

/**
 * Receives the leftovers of each search root as soon as that root is done.
 */
@FunctionalInterface
public interface OrphanScanListener {
    void onRootCompleted(LeftoverSearchRoot root, List<LeftoverFile> leftovers);

    static OrphanScanListener none() {
        return (root, leftovers) -> {
        };
    }
}
