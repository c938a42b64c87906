package ghost.overlay.cli;

import ghost.overlay.config.LogFormat;
import picocli.CommandLine;

@CommandLine.Command(name = "ghost-overlay", mixinStandardHelpOptions = true, version = "ghost-overlay 0.1.0",
        description = "Structural comparison of two JSON- or YAML-shaped documents")
public class CliArguments {

    @CommandLine.Option(names = {"-o", "--original"}, description = "Original document (repository-relative when --original-rev is set)", paramLabel = "FILE")
    private String original;

    @CommandLine.Option(names = {"-g", "--ghost"}, description = "Ghost document compared against the original", paramLabel = "FILE")
    private String ghost;

    @CommandLine.Option(names = "--repo", description = "Git working tree used with --original-rev (default: .)", paramLabel = "DIR")
    private String repository;

    @CommandLine.Option(names = "--original-rev", description = "Read the original document from this git revision", paramLabel = "REV")
    private String originalRevision;

    @CommandLine.Option(names = "--expand", description = "Show matching sections expanded")
    private boolean expand;

    @CommandLine.Option(names = "--exit-code", description = "Exit with status 1 when differences are found")
    private boolean exitCode;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public String original() {
        return original;
    }

    public String ghost() {
        return ghost;
    }

    public String repository() {
        return repository;
    }

    public String originalRevision() {
        return originalRevision;
    }

    public boolean expand() {
        return expand;
    }

    public boolean exitCode() {
        return exitCode;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
