package sh.harold.tidybox.cli;

import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import sh.harold.tidybox.core.catalog.CleanupCategory;
import sh.harold.tidybox.core.config.TidyboxConfig;
import sh.harold.tidybox.core.config.TidyboxConfigLoader;
import sh.harold.tidybox.core.orphan.Confidence;

/**
 * Command-line entry point: {@code tidybox [-c config] <scan|orphans|permissions|validate|clean>}.
 */
public final class TidyboxMain {
    static final int USAGE = 2;

    private static final Set<String> COMMANDS = Set.of("scan", "orphans", "permissions", "validate", "clean");

    private static final String SYNTAX = "tidybox [options] <scan|orphans|permissions|validate <path>...|clean>";

    private final PrintWriter out;
    private final System.Logger logger;

    TidyboxMain(PrintWriter out, System.Logger logger) {
        this.out = Objects.requireNonNull(out, "out");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public static void main(String[] args) {
        PrintWriter out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
        int status = new TidyboxMain(out, System.getLogger("sh.harold.tidybox")).run(args);
        out.flush();
        System.exit(status);
    }

    static Options options() {
        Options options = new Options();
        options.addOption(Option.builder("c").longOpt("config").hasArg().argName("file")
            .desc("Configuration file (default ~/.tidybox/" + TidyboxConfigLoader.FILE_NAME + ")").build());
        options.addOption(Option.builder("h").longOpt("help").desc("Print this help and exit").build());
        options.addOption(Option.builder().longOpt("full")
            .desc("permissions: also probe folders that may raise a consent prompt").build());
        options.addOption(Option.builder().longOpt("category").hasArg().argName("name")
            .desc("clean: only this category; repeatable").build());
        options.addOption(Option.builder().longOpt("orphans").desc("clean: remove leftovers instead of caches").build());
        options.addOption(Option.builder().longOpt("min-confidence").hasArg().argName("level")
            .desc("clean --orphans: LOW, MEDIUM or HIGH (default MEDIUM)").build());
        options.addOption(Option.builder("y").longOpt("yes").desc("clean: actually move items to the trash").build());
        return options;
    }

    int run(String[] args) {
        Options options = options();
        CommandLine commandLine;
        try {
            commandLine = parser().parse(options, args);
        } catch (ParseException e) {
            printHelp(options, e.getMessage());
            return USAGE;
        }
        List<String> arguments = commandLine.getArgList();
        if (commandLine.hasOption('h') || arguments.isEmpty()) {
            printHelp(options, null);
            return commandLine.hasOption('h') ? TidyboxCommand.OK : USAGE;
        }

        String command = arguments.get(0).toLowerCase(Locale.ROOT);
        if (!COMMANDS.contains(command)) {
            printHelp(options, "Unknown command: " + command);
            return USAGE;
        }
        Set<CleanupCategory> categories;
        Confidence minConfidence;
        try {
            categories = categories(commandLine);
            minConfidence = commandLine.hasOption("min-confidence")
                ? Confidence.valueOf(commandLine.getOptionValue("min-confidence").strip().toUpperCase(Locale.ROOT))
                : Confidence.MEDIUM;
        } catch (IllegalArgumentException e) {
            printHelp(options, e.getMessage());
            return USAGE;
        }

        Path userHome = Path.of(System.getProperty("user.home"));
        Path configPath = commandLine.hasOption('c')
            ? Path.of(commandLine.getOptionValue('c'))
            : TidyboxConfigLoader.defaultPath(userHome);
        TidyboxConfig config = TidyboxConfigLoader.loadOrCreate(configPath, userHome, logger);

        try (TidyboxRuntime runtime = TidyboxRuntime.start(config, logger)) {
            TidyboxCommand commands = new TidyboxCommand(runtime, out);
            return switch (command) {
                case "scan" -> commands.scan();
                case "orphans" -> commands.orphans();
                case "permissions" -> commands.permissions(commandLine.hasOption("full"));
                case "validate" -> commands.validate(arguments.subList(1, arguments.size()));
                case "clean" -> commands.clean(
                    categories,
                    commandLine.hasOption("orphans"),
                    minConfidence,
                    commandLine.hasOption('y')
                );
                default -> throw new IllegalStateException("Unhandled command: " + command);
            };
        } finally {
            out.flush();
        }
    }

    private static CommandLineParser parser() {
        return new DefaultParser();
    }

    private static Set<CleanupCategory> categories(CommandLine commandLine) {
        Set<CleanupCategory> categories = EnumSet.noneOf(CleanupCategory.class);
        String[] values = commandLine.getOptionValues("category");
        if (values != null) {
            for (String value : values) {
                categories.add(CleanupCategory.parse(value));
            }
        }
        return categories;
    }

    private void printHelp(Options options, String message) {
        new HelpFormatter().printHelp(
            out,
            100,
            SYNTAX,
            message,
            options,
            HelpFormatter.DEFAULT_LEFT_PAD,
            HelpFormatter.DEFAULT_DESC_PAD,
            null,
            false
        );
        out.flush();
    }
}
