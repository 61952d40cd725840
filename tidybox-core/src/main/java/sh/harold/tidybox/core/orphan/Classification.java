package sh.harold.tidybox.core.orphan;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of classifying one library entry.
 *
 * @param rule the rule that fired
 * @param token identifier-like token derived from the entry name
 * @param relatedIdentifier the identifier the rule matched against, when there is one
 */
public record Classification(MatchRule rule, String token, String relatedIdentifier) {
    public Classification {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(token, "token");
    }

    public Optional<Confidence> confidence() {
        return rule.confidence();
    }

    public boolean isOrphan() {
        return rule.orphan();
    }

    public Optional<String> related() {
        return Optional.ofNullable(relatedIdentifier);
    }
}
