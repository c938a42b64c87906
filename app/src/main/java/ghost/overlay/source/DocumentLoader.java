package ghost.overlay.source;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.errors.RevisionSyntaxException;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectLoader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads document text either from the working tree or from a committed revision. Both paths decode as UTF-8 and
 * replace malformed bytes with U+FFFD rather than rejecting the document.
 */
public class DocumentLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentLoader.class);

    public Document loadFile(Path path) {
        Objects.requireNonNull(path, "path");
        try {
            String content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            LOGGER.debug("Loaded {} ({} chars)", path, content.length());
            return new Document(path.toString(), content);
        } catch (IOException ex) {
            throw new DocumentLoadException("Failed to read document: " + path, ex);
        }
    }

    /**
     * @param repositoryRoot working tree of the repository
     * @param revision any revision string git understands, e.g. {@code HEAD~1} or a short sha
     * @param path file path relative to the repository root
     */
    public Document loadRevision(Path repositoryRoot, String revision, Path path) {
        Objects.requireNonNull(repositoryRoot, "repositoryRoot");
        Objects.requireNonNull(revision, "revision");
        Objects.requireNonNull(path, "path");
        String normalizedPath = path.toString().replace('\\', '/');

        try (Git git = Git.open(repositoryRoot.toFile())) {
            Repository repository = git.getRepository();
            ObjectId commitId = repository.resolve(revision);
            if (commitId == null) {
                throw new DocumentLoadException("Unknown revision: " + revision);
            }
            try (RevWalk walk = new RevWalk(repository)) {
                RevCommit commit = walk.parseCommit(commitId);
                try (TreeWalk treeWalk = TreeWalk.forPath(repository, normalizedPath, commit.getTree())) {
                    if (treeWalk == null) {
                        throw new DocumentLoadException(normalizedPath + " does not exist at " + revision);
                    }
                    ObjectLoader loader = repository.open(treeWalk.getObjectId(0));
                    String content = new String(loader.getBytes(), StandardCharsets.UTF_8);
                    LOGGER.debug("Loaded {}@{} ({} chars)", normalizedPath, revision, content.length());
                    return new Document(normalizedPath + "@" + revision, content);
                }
            }
        } catch (IOException | RevisionSyntaxException ex) {
            throw new DocumentLoadException("Failed to read " + normalizedPath + " at " + revision, ex);
        }
    }
}
