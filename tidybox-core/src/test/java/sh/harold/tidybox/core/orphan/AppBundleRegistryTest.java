package sh.harold.tidybox.core.orphan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AppBundleRegistryTest {
    private static final System.Logger LOGGER = System.getLogger("registry-test");

    @Test
    void installedApps_readsInfoPlist(@TempDir Path applications) throws IOException {
        writeBundle(applications, "Acme Editor", """
            <?xml version="1.0" encoding="UTF-8"?>
            <!DOCTYPE plist PUBLIC "-//Apple//DTD PLIST 1.0//EN" "http://www.apple.com/DTDs/PropertyList-1.0.dtd">
            <plist version="1.0">
            <dict>
                <key>CFBundleIdentifier</key>
                <string>com.acme.Editor</string>
                <key>CFBundleName</key>
                <string>Acme Editor</string>
                <key>LSRequiresNativeExecution</key>
                <true/>
                <key>CFBundleShortVersionString</key>
                <string>3.2.1</string>
            </dict>
            </plist>
            """);
        Files.write(applications.resolve("Acme Editor.app/Contents/MacOS-binary"), new byte[64]);

        List<InstalledApp> apps = new AppBundleRegistry(List.of(applications), LOGGER, true).installedApps();

        assertEquals(1, apps.size());
        InstalledApp app = apps.get(0);
        assertEquals("com.acme.Editor", app.bundleIdentifier());
        assertEquals("Acme Editor", app.name());
        assertEquals(Optional.of("3.2.1"), app.versionString());
        assertEquals(Optional.of("acme"), app.developerName());
        assertTrue(app.sizeBytes() >= 64L);
    }

    @Test
    void installedNames_includeBundlesWithoutReadableIdentifier(@TempDir Path applications) throws IOException {
        writeBundle(applications, "Binary Plist", "bplist00garbage");
        writeBundle(applications, "No Identifier", """
            <?xml version="1.0" encoding="UTF-8"?>
            <plist version="1.0"><dict><key>CFBundleName</key><string>Nameless</string></dict></plist>
            """);
        Files.createDirectories(applications.resolve("Not A Bundle"));

        AppBundleRegistry registry = new AppBundleRegistry(List.of(applications, applications.resolve("missing")), LOGGER, false);

        assertTrue(registry.installedApps().isEmpty());
        assertEquals(List.of("Binary Plist", "No Identifier"), List.copyOf(registry.installedNames()));
    }

    @Test
    void installedApps_ignoresExternalEntities(@TempDir Path applications) throws IOException {
        Path secret = Files.writeString(applications.resolve("secret.txt"), "top secret", StandardCharsets.UTF_8);
        writeBundle(applications, "Hostile", """
            <?xml version="1.0" encoding="UTF-8"?>
            <!DOCTYPE plist [<!ENTITY leak SYSTEM "%s">]>
            <plist version="1.0"><dict>
            <key>CFBundleIdentifier</key><string>com.evil.App</string>
            <key>CFBundleName</key><string>&leak;</string>
            </dict></plist>
            """.formatted(secret.toUri()));

        List<InstalledApp> apps = new AppBundleRegistry(List.of(applications), LOGGER, false).installedApps();

        assertTrue(apps.stream().noneMatch(app -> app.name().contains("top secret")));
    }

    private static void writeBundle(Path applications, String name, String plist) throws IOException {
        Path contents = Files.createDirectories(applications.resolve(name + ".app").resolve("Contents"));
        Files.writeString(contents.resolve("Info.plist"), plist, StandardCharsets.UTF_8);
    }
}
