package ghost.overlay.cli;

import ghost.overlay.config.Config;
import ghost.overlay.config.ConfigLoader;
import ghost.overlay.config.SystemEnvironmentReader;
import ghost.overlay.diff.DiffResult;
import ghost.overlay.diff.GhostOverlayComparator;
import ghost.overlay.logging.LoggingConfigurator;
import ghost.overlay.render.DiffRenderer;
import ghost.overlay.render.DifferenceNavigator;
import ghost.overlay.render.SectionExpansion;
import ghost.overlay.source.Document;
import ghost.overlay.source.DocumentLoadException;
import ghost.overlay.source.DocumentLoader;
import java.io.PrintWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and comparison pipeline.
 */
public final class CliApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_DIFFERENCES = 1;
    static final int EXIT_INVALID_INPUT = 2;
    static final int EXIT_LOAD_FAILURE = 3;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final DocumentLoader documentLoader;
    private final GhostOverlayComparator comparator;
    private final DiffRenderer renderer;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new DocumentLoader(),
                new GhostOverlayComparator(), new DiffRenderer());
    }

    CliApplication(ConfigLoader configLoader, DocumentLoader documentLoader,
                   GhostOverlayComparator comparator, DiffRenderer renderer) {
        this.configLoader = configLoader;
        this.documentLoader = documentLoader;
        this.comparator = comparator;
        this.renderer = renderer;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        return run(commandLine, cliArguments, args);
    }

    int run(CommandLine commandLine, CliArguments cliArguments, String[] args) {
        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return EXIT_INVALID_INPUT;
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            commandLine.getErr().println(ex.getMessage());
            return EXIT_INVALID_INPUT;
        }
        LoggingConfigurator.configure(config.logFormat());

        Document original;
        Document ghost;
        try {
            original = loadOriginal(config);
            ghost = documentLoader.loadFile(config.ghostPath());
        } catch (DocumentLoadException ex) {
            LOGGER.debug("Document load failed", ex);
            commandLine.getErr().println(ex.getMessage());
            return EXIT_LOAD_FAILURE;
        }

        LOGGER.info("Comparing {} against {}", ghost.displayName(), original.displayName());
        DiffResult result = comparator.compare(original.content(), ghost.content());
        LOGGER.info("Found {} differences in {} aligned lines ({} collapsed sections)",
                result.differenceCount(), result.diffLines().size(), result.collapsedSections().size());

        SectionExpansion expansion = config.expandSections()
                ? SectionExpansion.expanded(result)
                : SectionExpansion.collapsed();
        PrintWriter out = commandLine.getOut();
        renderer.render(result, expansion).forEach(out::println);
        out.flush();

        DifferenceNavigator navigator = new DifferenceNavigator(result);
        navigator.current().ifPresent(position -> LOGGER.info("First difference at row {} (ghost line {})",
                position + 1, result.ghostJumpTarget(position).map(line -> String.valueOf(line + 1)).orElse("-")));

        if (config.exitCodeOnDifference() && !result.isIdentical()) {
            return EXIT_DIFFERENCES;
        }
        return EXIT_OK;
    }

    private Document loadOriginal(Config config) {
        if (config.readsOriginalFromRevision()) {
            return documentLoader.loadRevision(config.repository(), config.originalRevision().orElseThrow(),
                    config.originalPath());
        }
        return documentLoader.loadFile(config.originalPath());
    }
}
