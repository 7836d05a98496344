package im.arun.pyfmt.service;

import im.arun.pyfmt.config.FormatterConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FormatterServiceTest {

    @TempDir
    Path dir;

    private final FormatterService service = new FormatterService(new FormatterConfig());

    private Path copyFixture(String name) throws Exception {
        Path fixtures = Paths.get(getClass().getResource("/fixtures").toURI());
        Path source = dir.resolve(name);
        Files.copy(fixtures.resolve(name), source);
        Files.copy(fixtures.resolve(name + ".ast.json"), dir.resolve(name + ".ast.json"));
        return source;
    }

    private static String fixtureText(String name) throws Exception {
        Path fixtures = Paths.get(FormatterServiceTest.class.getResource("/fixtures").toURI());
        return Files.readString(fixtures.resolve(name), StandardCharsets.UTF_8);
    }

    @Test
    void treeFileSitsNextToSource() {
        assertThat(service.treePath(Paths.get("pkg", "mod.py"))).isEqualTo(Paths.get("pkg", "mod.py.ast.json"));
    }

    @Test
    void formatsFileWithItsTree() throws Exception {
        Path source = copyFixture("generator.py");

        FormatResult result = service.formatFile(source);

        assertThat(result.isFailed()).isFalse();
        assertThat(result.getFormatted()).isEqualTo(fixtureText("generator.expected.py"));
        assertThat(result.isChanged()).isTrue();
    }

    @Test
    void missingTreeIsReportedAsFailure() throws Exception {
        Path source = dir.resolve("lonely.py");
        Files.writeString(source, "x = 1\n");

        FormatResult result = service.formatFile(source);

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getError()).contains("file not found").contains("lonely.py.ast.json");
    }

    @Test
    void malformedTreeIsReportedAsFailure() throws Exception {
        Path source = dir.resolve("broken.py");
        Files.writeString(source, "x = 1\n");
        Files.writeString(dir.resolve("broken.py.ast.json"), "{not json");

        FormatResult result = service.formatFile(source);

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getError()).contains("Malformed");
    }

    @Test
    void unsupportedConstructIsReportedAsFailure() throws Exception {
        Path source = dir.resolve("fstring.py");
        Files.writeString(source, "f'{x}'\n");
        Files.writeString(dir.resolve("fstring.py.ast.json"), "{\"_type\": \"Module\", \"body\": [{\"_type\": \"Expr\", "
                + "\"lineno\": 1, \"value\": {\"_type\": \"JoinedStr\", \"lineno\": 1, \"values\": []}}]}");

        FormatResult result = service.formatFile(source);

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getError()).contains("JoinedStr");
    }

    @Test
    void batchKeepsInputOrder() throws Exception {
        Path first = copyFixture("generator.py");
        Path missing = dir.resolve("missing.py");
        Path last = copyFixture("module_docstring.py");

        List<FormatResult> results = service.formatFiles(List.of(first, missing, last));

        assertThat(results).extracting(FormatResult::getPath).containsExactly(first, missing, last);
        assertThat(results).extracting(FormatResult::isFailed).containsExactly(false, true, false);
    }

    @Test
    void writeBackOnlyTouchesChangedFiles() throws Exception {
        Path source = copyFixture("generator.py");
        FormatResult result = service.formatFile(source);

        assertThat(service.writeBack(result)).isTrue();
        assertThat(Files.readString(source, StandardCharsets.UTF_8)).isEqualTo(fixtureText("generator.expected.py"));

        FormatResult unchanged = FormatResult.success(source, "same\n", "same\n");
        assertThat(service.writeBack(unchanged)).isFalse();
        assertThat(service.writeBack(FormatResult.failure(source, "boom"))).isFalse();
    }
}
