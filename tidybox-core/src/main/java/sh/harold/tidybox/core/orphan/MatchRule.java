package sh.harold.tidybox.core.orphan;

import java.util.Optional;

/**
 * Rules evaluated by {@link OrphanClassifier}, in evaluation order.
 */
public enum MatchRule {
    /** Token equals an installed identifier, or is a dotted child of one. */
    EXACT_IDENTIFIER(Confidence.HIGH, false),
    /** File name contains the display name of an installed application. */
    INSTALLED_NAME(Confidence.MEDIUM, false),
    /** Belongs to the operating system vendor. */
    SYSTEM_ITEM(null, false),
    /** Reverse-DNS developer segment matches that of a known identifier. */
    DEVELOPER_SEGMENT(Confidence.MEDIUM, true),
    /** File name mentions the developer of a known identifier. */
    FUZZY_DEVELOPER(Confidence.LOW, true),
    /** Nothing ties the item to any application. */
    NO_SIGNAL(null, false);

    private final Confidence confidence;
    private final boolean orphan;

    MatchRule(Confidence confidence, boolean orphan) {
        this.confidence = confidence;
        this.orphan = orphan;
    }

    public Optional<Confidence> confidence() {
        return Optional.ofNullable(confidence);
    }

    /**
     * Whether items matched by this rule are reported as leftovers of an uninstalled app.
     */
    public boolean orphan() {
        return orphan;
    }
}
