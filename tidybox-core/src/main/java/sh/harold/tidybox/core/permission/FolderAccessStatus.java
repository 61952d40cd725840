package sh.harold.tidybox.core.permission;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Readability of a folder as last observed.
 */
public enum FolderAccessStatus {
    UNCHECKED("Not checked"),
    NOT_EXISTS("Does not exist"),
    CHECKING("Checking"),
    DENIED("Access denied"),
    ACCESSIBLE("Accessible");

    private final String label;

    FolderAccessStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Combines folder statuses into one.
     *
     * <p>Missing folders are ignored. Of the rest, any folder still checking makes the whole set
     * checking, and any denied folder makes it denied. A set with unchecked folders left is
     * unchecked; it is accessible only when every folder was probed and read. Nothing left means
     * the set does not exist.
     */
    public static FolderAccessStatus rollup(Collection<FolderAccessStatus> statuses) {
        Objects.requireNonNull(statuses, "statuses");
        List<FolderAccessStatus> present = statuses.stream()
            .filter(status -> status != NOT_EXISTS)
            .toList();
        if (present.isEmpty()) {
            return NOT_EXISTS;
        }
        if (present.contains(CHECKING)) {
            return CHECKING;
        }
        if (present.contains(DENIED)) {
            return DENIED;
        }
        return present.contains(UNCHECKED) ? UNCHECKED : ACCESSIBLE;
    }
}
