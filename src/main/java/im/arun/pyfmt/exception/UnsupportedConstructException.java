package im.arun.pyfmt.exception;

/**
 * The tree contains a construct the formatter has no layout for.
 */
public class UnsupportedConstructException extends FormatterException {
    private final String kind;
    private final int line;

    public UnsupportedConstructException(String kind, int line) {
        super(line > 0
                ? "Unsupported construct " + kind + " at line " + line
                : "Unsupported construct " + kind);
        this.kind = kind;
        this.line = line;
    }

    public String getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }
}
