package sh.harold.tidybox.core.orphan;

/**
 * Certainty that residue belongs to a specific application. Declaration order is the ranking:
 * {@code LOW < MEDIUM < HIGH}.
 */
public enum Confidence {
    LOW("Possible match - verify before removing"),
    MEDIUM("Likely match - review recommended"),
    HIGH("Exact match - safe to remove");

    private final String description;

    Confidence(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    public boolean outranks(Confidence other) {
        return compareTo(other) > 0;
    }

    public boolean isAtLeast(Confidence other) {
        return compareTo(other) >= 0;
    }
}
