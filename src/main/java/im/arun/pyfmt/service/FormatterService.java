package im.arun.pyfmt.service;

import im.arun.pyfmt.config.FormatterConfig;
import im.arun.pyfmt.exception.FormatterException;
import im.arun.pyfmt.exception.TreeParseException;
import im.arun.pyfmt.format.PythonFormatter;
import im.arun.pyfmt.model.Module;
import im.arun.pyfmt.tree.JsonTreeReader;
import im.arun.pyfmt.util.ExecutorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Formats source files on disk. Each file {@code x.py} is read together with its parsed
 * tree {@code x.py<astSuffix>}, produced beforehand by the Python parser.
 */
public class FormatterService {
    private static final Logger logger = LoggerFactory.getLogger(FormatterService.class);

    private final FormatterConfig config;
    private final PythonFormatter formatter;
    private final JsonTreeReader treeReader;

    public FormatterService(FormatterConfig config) {
        this.config = config;
        this.formatter = new PythonFormatter(config);
        this.treeReader = new JsonTreeReader();
    }

    /**
     * Formats {@code source} given the JSON tree parsed from it.
     */
    public String formatSource(String source, String treeJson) throws TreeParseException {
        Module module = treeReader.read(treeJson);
        return formatter.serialize(module, source);
    }

    public Path treePath(Path source) {
        return source.resolveSibling(source.getFileName() + config.getAstSuffix());
    }

    /**
     * Formats one file. Failures are reported in the result rather than thrown.
     */
    public FormatResult formatFile(Path source) {
        try {
            String original = Files.readString(source, StandardCharsets.UTF_8);
            String formatted = formatSource(original, Files.readString(treePath(source), StandardCharsets.UTF_8));
            logger.debug("Formatted {}", source);
            return FormatResult.success(source, original, formatted);
        } catch (NoSuchFileException e) {
            logger.warn("Missing file {}", e.getFile());
            return FormatResult.failure(source, "file not found: " + e.getFile());
        } catch (IOException | FormatterException e) {
            logger.warn("Failed to format {}: {}", source, e.getMessage());
            return FormatResult.failure(source, e.getMessage());
        }
    }

    /**
     * Formats every file concurrently on the shared worker pool. Results keep the order
     * of {@code sources}.
     */
    public List<FormatResult> formatFiles(List<Path> sources) {
        ExecutorService executor = ExecutorProvider.getExecutor();
        List<CompletableFuture<FormatResult>> futures = sources.stream()
                .map(source -> CompletableFuture.supplyAsync(() -> formatFile(source), executor))
                .collect(Collectors.toList());

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<FormatResult> results = futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());
        long failed = results.stream().filter(FormatResult::isFailed).count();
        logger.info("Formatted {} files, {} failed", results.size(), failed);
        return results;
    }

    /**
     * Writes the formatted text back over the source file when it differs.
     *
     * @return whether the file was rewritten
     */
    public boolean writeBack(FormatResult result) throws IOException {
        if (!result.isChanged()) {
            return false;
        }
        Files.writeString(result.getPath(), result.getFormatted(), StandardCharsets.UTF_8);
        logger.info("Rewrote {}", result.getPath());
        return true;
    }

    public FormatterConfig getConfig() {
        return config;
    }
}
