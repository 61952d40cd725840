package sh.harold.tidybox.core.orphan;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Classifies library entries against the installed and previously known applications.
 *
 * <p>An entry is only reported as an orphan when nothing installed claims it and some positive
 * signal points at a developer we have seen before. Entries with no signal at all are left
 * alone.
 */
public final class OrphanClassifier {
    private static final int MIN_FUZZY_LENGTH = 3;
    private static final List<String> SYSTEM_PATTERNS = List.of(
        "apple", "macos", "finder", "safari", "mail.app", "calendar", "contacts",
        "photos", "music", "tv", "news", "stocks", "home", "notes", "reminders",
        "books", "preview", "textedit", "quicktime", "automator", "terminal",
        "console", "activity monitor", "disk utility", "migration assistant",
        "system preferences", "system settings", "font book", "colorsync",
        "digital color meter", "grapher", "keychain access", "screenshot",
        "voice memos", "bootcamp", "bluetooth", "audio midi setup",
        "launchservices", "loginitems", "startup", "backgrounditems",
        "cloudd", "appstore", "itunes", "xcode", "instruments", "simulator"
    );

    private final List<String> installedIdentifiers;
    private final List<String> installedNames;
    private final List<String> knownIdentifiers;

    /**
     * @param installedIdentifiers identifiers of applications installed right now
     * @param installedNames display names of applications installed right now
     * @param knownIdentifiers identifiers ever seen installed; installed ones are added implicitly
     */
    public OrphanClassifier(Set<String> installedIdentifiers, Set<String> installedNames, Set<String> knownIdentifiers) {
        Objects.requireNonNull(installedIdentifiers, "installedIdentifiers");
        Objects.requireNonNull(installedNames, "installedNames");
        Objects.requireNonNull(knownIdentifiers, "knownIdentifiers");
        this.installedIdentifiers = installedIdentifiers.stream().sorted().toList();
        this.installedNames = installedNames.stream()
            .map(BundleIdentifiers::normalizeName)
            .filter(name -> !name.isEmpty())
            .distinct()
            .sorted()
            .toList();
        this.knownIdentifiers = Stream.concat(installedIdentifiers.stream(), knownIdentifiers.stream())
            .distinct()
            .sorted()
            .toList();
    }

    public Classification classify(String entryName) {
        Objects.requireNonNull(entryName, "entryName");
        String token = BundleIdentifiers.tokenFor(entryName);
        String lowerToken = token.toLowerCase(Locale.ROOT);
        String normalizedName = BundleIdentifiers.normalizeName(entryName);

        for (String installed : installedIdentifiers) {
            String lowerInstalled = installed.toLowerCase(Locale.ROOT);
            if (lowerToken.equals(lowerInstalled) || lowerToken.startsWith(lowerInstalled + ".")) {
                return new Classification(MatchRule.EXACT_IDENTIFIER, token, installed);
            }
        }

        for (String name : installedNames) {
            if (normalizedName.contains(name)) {
                return new Classification(MatchRule.INSTALLED_NAME, token, null);
            }
        }

        String lowerName = entryName.toLowerCase(Locale.ROOT);
        for (String pattern : SYSTEM_PATTERNS) {
            if (lowerName.contains(pattern)) {
                return new Classification(MatchRule.SYSTEM_ITEM, token, null);
            }
        }

        if (BundleIdentifiers.isReverseDns(token)) {
            Optional<String> developer = BundleIdentifiers.developerSegment(token);
            if (developer.isPresent()) {
                for (String known : knownIdentifiers) {
                    Optional<String> knownDeveloper = BundleIdentifiers.developerSegment(known);
                    if (knownDeveloper.isPresent() && knownDeveloper.get().equalsIgnoreCase(developer.get())) {
                        return new Classification(MatchRule.DEVELOPER_SEGMENT, token, known);
                    }
                }
            }
        }

        for (String known : knownIdentifiers) {
            Optional<String> knownDeveloper = BundleIdentifiers.developerSegment(known);
            if (knownDeveloper.isEmpty() || knownDeveloper.get().length() < MIN_FUZZY_LENGTH) {
                continue;
            }
            if (normalizedName.contains(BundleIdentifiers.normalizeName(knownDeveloper.get()))) {
                return new Classification(MatchRule.FUZZY_DEVELOPER, token, known);
            }
        }

        return new Classification(MatchRule.NO_SIGNAL, token, null);
    }
}
