package im.arun.pyfmt.cli;

import im.arun.pyfmt.config.ConfigLoader;
import im.arun.pyfmt.config.FormatterConfig;
import im.arun.pyfmt.service.FormatResult;
import im.arun.pyfmt.service.FormatterService;
import im.arun.pyfmt.util.ExecutorProvider;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Command-line interface for pyfmt using Picocli.
 *
 * <p>Exit codes: 0 when every file formatted, 1 when {@code --check} found a file that
 * would change, 2 when any file failed.
 */
@Command(
    name = "pyfmt",
    description = "Rewrite Python source files into canonical layout from their parsed trees",
    mixinStandardHelpOptions = true,
    version = "pyfmt 1.0"
)
public class PyFmtCLI implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_CHANGES = 1;
    static final int EXIT_FAILURE = 2;

    @Parameters(paramLabel = "FILE", arity = "1..*", description = "Python source files to format")
    private List<Path> files;

    @Option(names = {"--max-line-length"}, description = "Maximum output line width")
    private Integer maxLineLength;

    @Option(names = {"--quote"}, description = "String delimiter, \" or '")
    private String quote;

    @Option(names = {"--tab"}, description = "Indentation unit: a number of spaces, or \\t for a tab")
    private String tab;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--ast-suffix"}, description = "Suffix of the parsed tree next to each source file")
    private String astSuffix;

    @Option(names = {"--in-place"}, description = "Rewrite the files instead of printing them")
    private boolean inPlace;

    @Option(names = {"--check"}, description = "Only report files that would change")
    private boolean check;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final Function<FormatterConfig, FormatterService> serviceFactory;

    public PyFmtCLI() {
        this(FormatterService::new);
    }

    PyFmtCLI(Function<FormatterConfig, FormatterService> serviceFactory) {
        this.serviceFactory = serviceFactory;
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        FormatterConfig config;
        try {
            config = new ConfigLoader(configPath).load(overrides());
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }

        FormatterService service = serviceFactory.apply(config);
        List<FormatResult> results = service.formatFiles(files);

        int exitCode = EXIT_OK;
        for (FormatResult result : results) {
            if (result.isFailed()) {
                err.println("Error: " + result.getPath() + ": " + result.getError());
                exitCode = EXIT_FAILURE;
            } else if (check) {
                if (result.isChanged()) {
                    out.println("would reformat " + result.getPath());
                    exitCode = Math.max(exitCode, EXIT_CHANGES);
                }
            } else if (inPlace) {
                try {
                    if (service.writeBack(result)) {
                        out.println("reformatted " + result.getPath());
                    }
                } catch (IOException e) {
                    err.println("Error: " + result.getPath() + ": " + e.getMessage());
                    exitCode = EXIT_FAILURE;
                }
            } else {
                out.print(result.getFormatted());
            }
        }
        out.flush();
        return exitCode;
    }

    private Map<String, Object> overrides() {
        Map<String, Object> options = new HashMap<>();
        options.put("max_line_length", maxLineLength);
        options.put("quote", quote);
        options.put("tab", tab);
        options.put("ast_suffix", astSuffix);
        return options;
    }

    public static void main(String[] args) {
        try {
            int exitCode = new CommandLine(new PyFmtCLI()).execute(args);
            System.exit(exitCode);
        } finally {
            ExecutorProvider.shutdown();
        }
    }
}
