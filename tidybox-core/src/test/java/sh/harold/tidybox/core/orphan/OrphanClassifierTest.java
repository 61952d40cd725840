package sh.harold.tidybox.core.orphan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class OrphanClassifierTest {
    private final OrphanClassifier classifier = new OrphanClassifier(
        Set.of("com.acme.Editor", "org.videolan.vlc"),
        Set.of("Acme Editor", "VLC"),
        Set.of("com.oldsoft.Painter")
    );

    @Test
    void classify_installedIdentifier_isNeverOrphan() {
        for (String name : List.of(
            "com.acme.Editor",
            "com.acme.Editor.plist",
            "COM.ACME.EDITOR",
            "com.acme.Editor.helper",
            "com.acme.Editor.savedState",
            "group.com.acme.Editor",
            "ABCDE12345.com.acme.Editor",
            "org.videolan.vlc"
        )) {
            Classification classification = classifier.classify(name);
            assertEquals(MatchRule.EXACT_IDENTIFIER, classification.rule(), name);
            assertFalse(classification.isOrphan(), name);
        }
    }

    @Test
    void classify_installedDisplayName_isOwned() {
        Classification classification = classifier.classify("Acme Editor");

        assertEquals(MatchRule.INSTALLED_NAME, classification.rule());
        assertFalse(classification.isOrphan());
    }

    @Test
    void classify_systemItems_areLeftAlone() {
        assertEquals(MatchRule.SYSTEM_ITEM, classifier.classify("com.apple.Safari").rule());
        assertEquals(MatchRule.SYSTEM_ITEM, classifier.classify("com.oldsoft.Xcode-helper").rule());
    }

    @Test
    void classify_knownDeveloperSegment_isMediumOrphan() {
        Classification classification = classifier.classify("com.oldsoft.Sketcher.plist");

        assertEquals(MatchRule.DEVELOPER_SEGMENT, classification.rule());
        assertTrue(classification.isOrphan());
        assertEquals(Optional.of(Confidence.MEDIUM), classification.confidence());
        assertEquals(Optional.of("com.oldsoft.Painter"), classification.related());
        assertEquals("com.oldsoft.Sketcher", classification.token());
    }

    @Test
    void classify_developerNameInFileName_isLowOrphan() {
        Classification classification = classifier.classify("OldSoft Shared");

        assertEquals(MatchRule.FUZZY_DEVELOPER, classification.rule());
        assertEquals(Optional.of(Confidence.LOW), classification.confidence());
        assertEquals(Optional.of("com.oldsoft.Painter"), classification.related());
    }

    @Test
    void classify_withoutAnySignal_isNotReported() {
        Classification classification = classifier.classify("RandomThing");

        assertEquals(MatchRule.NO_SIGNAL, classification.rule());
        assertFalse(classification.isOrphan());
        assertTrue(classification.confidence().isEmpty());
    }

    @Test
    void confidence_orderingIsTotal() {
        assertTrue(Confidence.HIGH.outranks(Confidence.MEDIUM));
        assertTrue(Confidence.MEDIUM.outranks(Confidence.LOW));
        assertTrue(Confidence.HIGH.outranks(Confidence.LOW));
        assertFalse(Confidence.LOW.outranks(Confidence.LOW));
        assertTrue(Confidence.MEDIUM.isAtLeast(Confidence.MEDIUM));
        assertFalse(Confidence.LOW.isAtLeast(Confidence.MEDIUM));
    }

    @Test
    void bundleIdentifiers_reverseDnsAndDeveloper() {
        assertTrue(BundleIdentifiers.isReverseDns("com.acme.Editor"));
        assertTrue(BundleIdentifiers.isReverseDns("dev.tool"));
        assertFalse(BundleIdentifiers.isReverseDns("Acme Editor"));
        assertFalse(BundleIdentifiers.isReverseDns("uk.co.vendor.App"));
        assertEquals(Optional.of("acme"), BundleIdentifiers.developerSegment("com.acme.Editor"));
        assertEquals(Optional.empty(), BundleIdentifiers.developerSegment("standalone"));
    }
}
