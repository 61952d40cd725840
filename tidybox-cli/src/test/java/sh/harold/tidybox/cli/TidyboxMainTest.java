package sh.harold.tidybox.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TidyboxMainTest {
    private final StringWriter output = new StringWriter();
    private final TidyboxMain main = new TidyboxMain(new PrintWriter(output, true), System.getLogger("cli-test"));

    @Test
    void help_printsUsageAndSucceeds() {
        assertEquals(TidyboxCommand.OK, main.run(new String[] {"--help"}));
        assertTrue(output.toString().contains("usage: tidybox"), output.toString());
        assertTrue(output.toString().contains("--min-confidence"), output.toString());
    }

    @Test
    void missingCommand_isUsageError() {
        assertEquals(TidyboxMain.USAGE, main.run(new String[0]));
    }

    @Test
    void unknownCommand_isUsageError() {
        assertEquals(TidyboxMain.USAGE, main.run(new String[] {"defrag"}));
        assertTrue(output.toString().contains("Unknown command: defrag"), output.toString());
    }

    @Test
    void unknownOption_isUsageError() {
        assertEquals(TidyboxMain.USAGE, main.run(new String[] {"scan", "--everything"}));
    }

    @Test
    void badCategoryOrConfidence_isUsageError() {
        assertEquals(TidyboxMain.USAGE, main.run(new String[] {"clean", "--category", "everything"}));
        assertEquals(TidyboxMain.USAGE, main.run(new String[] {"clean", "--orphans", "--min-confidence", "certain"}));
    }

    @Test
    void validate_usesHomeFromConfigFile(@TempDir Path tempDir) throws IOException {
        Path home = Files.createDirectories(tempDir.resolve("home"));
        Files.createDirectories(home.resolve("Library/Caches/AppX"));
        Path config = tempDir.resolve("tidybox.properties");
        Files.writeString(config, "home=" + home + "\nscan.threads=2\n");

        int safe = main.run(new String[] {"-c", config.toString(), "validate", "~/Library/Caches/AppX"});
        int unsafe = main.run(new String[] {"-c", config.toString(), "validate", "~/Documents"});

        assertEquals(TidyboxCommand.OK, safe);
        assertEquals(TidyboxCommand.FAILED, unsafe);
        assertTrue(output.toString().contains("PROTECTED_PATH  ~/Documents"), output.toString());
    }
}
