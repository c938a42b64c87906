package ghost.overlay.config;

import ghost.overlay.cli.CliArguments;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_ORIGINAL = "GHOST_ORIGINAL";
    static final String ENV_GHOST = "GHOST_FILE";
    static final String ENV_REPOSITORY = "GHOST_REPOSITORY";
    static final String ENV_ORIGINAL_REV = "GHOST_ORIGINAL_REV";
    static final String ENV_EXPAND_SECTIONS = "GHOST_EXPAND_SECTIONS";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String DEFAULT_REPOSITORY = ".";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        Path originalPath = resolvePath(arguments.original(), ENV_ORIGINAL, "original document must be provided");
        Path ghostPath = resolvePath(arguments.ghost(), ENV_GHOST, "ghost document must be provided");
        Path repository = toPath(firstNonBlank(arguments.repository(), ENV_REPOSITORY, DEFAULT_REPOSITORY));

        Optional<String> originalRevision = Optional.ofNullable(arguments.originalRevision())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> environmentReader.get(ENV_ORIGINAL_REV).filter(ConfigLoader::isNotBlank));

        boolean expandSections = arguments.expand() || environmentReader.get(ENV_EXPAND_SECTIONS)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);

        return new Config(originalPath, ghostPath, repository, originalRevision, expandSections,
                arguments.exitCode(), resolveLogFormat(arguments));
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private Path resolvePath(String cliValue, String envKey, String errorMessage) {
        if (isNotBlank(cliValue)) {
            return toPath(cliValue);
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::toPath)
                .orElseThrow(() -> new IllegalArgumentException(errorMessage));
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultValue);
    }

    private static Path toPath(String raw) {
        try {
            return Path.of(raw.trim());
        } catch (InvalidPathException ex) {
            throw new IllegalArgumentException("Invalid path: " + raw, ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
