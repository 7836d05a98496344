package im.arun.pyfmt.cli;

import im.arun.pyfmt.service.FormatResult;
import im.arun.pyfmt.service.FormatterService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

class PyFmtCLITest {

    @TempDir
    Path dir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine cli;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cli = new CommandLine(new PyFmtCLI());
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
    }

    private Path copyFixture(String name, String as) throws Exception {
        Path fixtures = Paths.get(getClass().getResource("/fixtures").toURI());
        Path source = dir.resolve(as);
        Files.copy(fixtures.resolve(name), source);
        Files.copy(fixtures.resolve(name + ".ast.json"), dir.resolve(as + ".ast.json"));
        return source;
    }

    private static String expected() throws Exception {
        Path fixtures = Paths.get(PyFmtCLITest.class.getResource("/fixtures").toURI());
        return Files.readString(fixtures.resolve("generator.expected.py"), StandardCharsets.UTF_8);
    }

    @Test
    void printsFormattedSource() throws Exception {
        Path source = copyFixture("generator.py", "gen.py");

        int exitCode = cli.execute(source.toString());

        assertThat(exitCode).isEqualTo(PyFmtCLI.EXIT_OK);
        assertThat(out.toString()).isEqualTo(expected());
    }

    @Test
    void checkReportsFilesThatWouldChange() throws Exception {
        Path messy = copyFixture("generator.py", "messy.py");
        Path clean = copyFixture("generator.expected.py", "clean.py");

        int exitCode = cli.execute("--check", messy.toString(), clean.toString());

        assertThat(exitCode).isEqualTo(PyFmtCLI.EXIT_CHANGES);
        assertThat(out.toString()).contains("would reformat " + messy).doesNotContain("clean.py");
        assertThat(Files.readString(messy, StandardCharsets.UTF_8)).isNotEqualTo(expected());
    }

    @Test
    void checkPassesOnCleanFiles() throws Exception {
        Path clean = copyFixture("generator.expected.py", "clean.py");

        assertThat(cli.execute("--check", clean.toString())).isEqualTo(PyFmtCLI.EXIT_OK);
    }

    @Test
    void inPlaceRewritesFiles() throws Exception {
        Path source = copyFixture("generator.py", "gen.py");

        int exitCode = cli.execute("--in-place", source.toString());

        assertThat(exitCode).isEqualTo(PyFmtCLI.EXIT_OK);
        assertThat(out.toString()).contains("reformatted " + source);
        assertThat(Files.readString(source, StandardCharsets.UTF_8)).isEqualTo(expected());
    }

    @Test
    void failuresExitWithTwo() throws Exception {
        Path good = copyFixture("generator.py", "gen.py");
        Path missing = dir.resolve("nothing.py");

        int exitCode = cli.execute("--check", good.toString(), missing.toString());

        assertThat(exitCode).isEqualTo(PyFmtCLI.EXIT_FAILURE);
        assertThat(err.toString()).contains("Error: " + missing);
    }

    @Test
    void failedRewriteExitsWithTwo() throws Exception {
        Path source = copyFixture("generator.py", "gen.py");
        Path other = copyFixture("generator.py", "other.py");
        String original = Files.readString(source, StandardCharsets.UTF_8);
        CommandLine failing = new CommandLine(new PyFmtCLI(config -> new FormatterService(config) {
            @Override
            public boolean writeBack(FormatResult result) throws IOException {
                if (result.getPath().equals(source)) {
                    throw new IOException("Read-only file system");
                }
                return super.writeBack(result);
            }
        }));
        failing.setOut(new PrintWriter(out));
        failing.setErr(new PrintWriter(err));

        int exitCode = failing.execute("--in-place", source.toString(), other.toString());

        assertThat(exitCode).isEqualTo(PyFmtCLI.EXIT_FAILURE);
        assertThat(err.toString()).contains("Error: " + source + ": Read-only file system");
        assertThat(Files.readString(source, StandardCharsets.UTF_8)).isEqualTo(original);
        assertThat(Files.readString(other, StandardCharsets.UTF_8)).isEqualTo(expected());
    }

    @Test
    void invalidOptionExitsWithTwo() throws Exception {
        Path source = copyFixture("generator.py", "gen.py");

        int exitCode = cli.execute("--quote", "`", source.toString());

        assertThat(exitCode).isEqualTo(PyFmtCLI.EXIT_FAILURE);
        assertThat(err.toString()).contains("quote");
    }

    @Test
    void spacesIndentationFromCommandLine() throws Exception {
        Path source = copyFixture("generator.py", "gen.py");

        int exitCode = cli.execute("--tab", "2", source.toString());

        assertThat(exitCode).isEqualTo(PyFmtCLI.EXIT_OK);
        assertThat(out.toString()).contains("\n  x = 0\n").contains("\n    yield x\n");
    }
}
