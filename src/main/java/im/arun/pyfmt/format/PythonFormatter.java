package im.arun.pyfmt.format;

import im.arun.pyfmt.comment.CommentCursor;
import im.arun.pyfmt.comment.CommentScanner;
import im.arun.pyfmt.comment.CommentTable;
import im.arun.pyfmt.config.FormatterConfig;
import im.arun.pyfmt.exception.FormatterException;
import im.arun.pyfmt.layout.LayoutContext;
import im.arun.pyfmt.model.Module;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the layout engine: turns a parsed module plus its raw source into
 * canonical text.
 *
 * <p>Each call scans the source for comments and builds its own cursor and root context,
 * so one instance can format many modules, also concurrently.
 */
public class PythonFormatter {
    private static final Logger logger = LoggerFactory.getLogger(PythonFormatter.class);

    private final FormatterConfig config;
    private final CommentScanner scanner = new CommentScanner();
    private final NodeSerializer serializer = new NodeSerializer();

    public PythonFormatter() {
        this(new FormatterConfig());
    }

    public PythonFormatter(FormatterConfig config) {
        config.validate();
        this.config = config;
    }

    /**
     * Formats {@code module}. {@code source} is only read for its comments and may be null.
     *
     * @return the formatted text, ending in exactly one newline
     * @throws FormatterException when the module cannot be laid out
     */
    public String serialize(Module module, String source) {
        CommentTable table = scanner.scan(source == null ? "" : source);
        LayoutContext root = LayoutContext.root(config, new CommentCursor(table));
        String text;
        try {
            text = serializer.formatModule(module, root);
        } catch (StackOverflowError e) {
            throw new FormatterException("input nested too deeply", e);
        }
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '\n') {
            end--;
        }
        logger.debug("Formatted module of {} statements, {} comments", module.body().size(), table.count());
        return text.substring(0, end) + "\n";
    }

    public FormatterConfig getConfig() {
        return config;
    }
}
