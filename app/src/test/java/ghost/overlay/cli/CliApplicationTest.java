package ghost.overlay.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ghost.overlay.config.ConfigLoader;
import ghost.overlay.diff.GhostOverlayComparator;
import ghost.overlay.render.DiffRenderer;
import ghost.overlay.source.DocumentLoader;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.eclipse.jgit.api.Git;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private CliApplication application;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        application = new CliApplication(new ConfigLoader(key -> Optional.empty()), new DocumentLoader(),
                new GhostOverlayComparator(), new DiffRenderer());
        out = new StringWriter();
        err = new StringWriter();
    }

    @Test
    void printsRenderedComparison() throws Exception {
        Path original = write("original.json", "\"a\": 1\n\"b\": 2\n\"c\": 3");
        Path ghost = write("ghost.json", "\"a\": 1\n\"b\": 5\n\"c\": 3");

        int exitCode = run("--original", original.toString(), "--ghost", ghost.toString());

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(out.toString())
                .contains("   2 - Original \"b\": 2")
                .contains("   2 + Ghost    \"b\": 5")
                .contains("1 difference");
    }

    @Test
    void exitCodeFlagReportsDifferences() throws Exception {
        Path original = write("a.yaml", "a: 1");
        Path ghost = write("b.yaml", "a: 2");

        assertThat(run("-o", original.toString(), "-g", ghost.toString(), "--exit-code"))
                .isEqualTo(CliApplication.EXIT_DIFFERENCES);
    }

    @Test
    void exitCodeFlagIsZeroForIdenticalDocuments() throws Exception {
        Path original = write("a.yaml", "a: 1\nb: 2\nc: 3\n");
        Path ghost = write("b.yaml", "  a: 1\nb: 2\nc: 3\n");

        int exitCode = run("-o", original.toString(), "-g", ghost.toString(), "--exit-code", "--expand");

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(out.toString()).contains("▾ Lines 1-4 match (4 lines)").contains("0 differences");
    }

    @Test
    void comparesWorkingFileAgainstCommittedRevision() throws Exception {
        Path repo = tempDir.resolve("repo");
        Files.createDirectories(repo);
        try (Git git = Git.init().setDirectory(repo.toFile()).call()) {
            git.getRepository().getConfig().setString("user", null, "name", "Test User");
            git.getRepository().getConfig().setString("user", null, "email", "test@example.com");
            git.getRepository().getConfig().save();
            Files.writeString(repo.resolve("app.yaml"), "name: a\nport: 80\n", StandardCharsets.UTF_8);
            git.add().addFilepattern("app.yaml").call();
            git.commit().setMessage("initial").setSign(false).call();
        }
        Files.writeString(repo.resolve("app.yaml"), "name: a\nport: 8080\n", StandardCharsets.UTF_8);

        int exitCode = run("--repo", repo.toString(), "--original-rev", "HEAD",
                "-o", "app.yaml", "-g", repo.resolve("app.yaml").toString());

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_OK);
        assertThat(out.toString())
                .contains("   2 - Original port: 80")
                .contains("   2 + Ghost    port: 8080");
    }

    @Test
    void missingDocumentArgumentIsInvalidInput() throws Exception {
        Path original = write("a.yaml", "a: 1");

        int exitCode = run("-o", original.toString());

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_INVALID_INPUT);
        assertThat(err.toString()).contains("ghost document must be provided");
    }

    @Test
    void unknownOptionPrintsUsage() {
        int exitCode = run("--bogus");

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_INVALID_INPUT);
        assertThat(err.toString()).contains("Usage: ghost-overlay");
    }

    @Test
    void unreadableDocumentIsLoadFailure() throws Exception {
        Path original = write("a.yaml", "a: 1");

        int exitCode = run("-o", original.toString(), "-g", tempDir.resolve("missing.yaml").toString());

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_LOAD_FAILURE);
        assertThat(err.toString()).contains("missing.yaml");
    }

    @Test
    void helpIsPrintedToStdout() {
        assertThat(run("--help")).isZero();
        assertThat(out.toString()).contains("--original-rev");
    }

    private int run(String... args) {
        CliArguments arguments = new CliArguments();
        CommandLine commandLine = new CommandLine(arguments);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return application.run(commandLine, arguments, args);
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
