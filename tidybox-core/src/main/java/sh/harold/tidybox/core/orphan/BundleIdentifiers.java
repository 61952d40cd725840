package sh.harold.tidybox.core.orphan;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives identifier-like tokens from library entry names.
 */
public final class BundleIdentifiers {
    private static final Set<String> TOP_LEVEL_SEGMENTS = Set.of("com", "org", "net", "io", "co", "app", "me", "dev");
    private static final List<String> STRIPPED_SUFFIXES = List.of(".plist", ".savedState", ".binarycookies");
    private static final String GROUP_PREFIX = "group.";
    private static final Pattern TEAM_PREFIX = Pattern.compile("^[A-Z0-9]{10}\\.(.+)$");

    private BundleIdentifiers() {
    }

    /**
     * Strips plist/saved-state suffixes, the {@code group.} prefix and a leading ten-character team
     * id from an entry name.
     */
    public static String tokenFor(String entryName) {
        String token = entryName;
        for (String suffix : STRIPPED_SUFFIXES) {
            if (token.endsWith(suffix) && token.length() > suffix.length()) {
                token = token.substring(0, token.length() - suffix.length());
                break;
            }
        }
        if (token.startsWith(GROUP_PREFIX) && token.length() > GROUP_PREFIX.length()) {
            token = token.substring(GROUP_PREFIX.length());
        }
        var teamPrefixed = TEAM_PREFIX.matcher(token);
        if (teamPrefixed.matches()) {
            token = teamPrefixed.group(1);
        }
        return token;
    }

    /**
     * Whether the token looks like {@code com.vendor.product}.
     */
    public static boolean isReverseDns(String token) {
        String[] segments = token.split("\\.");
        if (segments.length < 2 || segments[1].isEmpty()) {
            return false;
        }
        return TOP_LEVEL_SEGMENTS.contains(segments[0].toLowerCase(Locale.ROOT));
    }

    public static Optional<String> developerSegment(String identifier) {
        String[] segments = identifier.split("\\.");
        if (segments.length < 2 || segments[1].isBlank()) {
            return Optional.empty();
        }
        return Optional.of(segments[1]);
    }

    /**
     * Lower-cases and removes whitespace so names compare loosely.
     */
    public static String normalizeName(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
    }
}
