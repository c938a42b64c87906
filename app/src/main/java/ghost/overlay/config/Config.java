package ghost.overlay.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 *
 * @param originalPath original document, or its repository-relative path when {@code originalRevision} is set
 * @param ghostPath ghost document on disk
 * @param repository git working tree used to resolve {@code originalRevision}
 */
public record Config(
        Path originalPath,
        Path ghostPath,
        Path repository,
        Optional<String> originalRevision,
        boolean expandSections,
        boolean exitCodeOnDifference,
        LogFormat logFormat
) {

    public Config {
        Objects.requireNonNull(originalPath, "originalPath");
        Objects.requireNonNull(ghostPath, "ghostPath");
        Objects.requireNonNull(repository, "repository");
        originalRevision = originalRevision == null
                ? Optional.empty()
                : originalRevision.map(String::trim).filter(value -> !value.isEmpty());
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        if (originalRevision.isPresent() && originalPath.isAbsolute()) {
            throw new IllegalArgumentException("original path must be relative to the repository when a revision is given");
        }
    }

    public boolean readsOriginalFromRevision() {
        return originalRevision.isPresent();
    }
}
