package im.arun.pyfmt.model;

/**
 * Source location of a statement: 1-based first and last line, 0-based column.
 * Statements synthesized by the formatter carry {@link #NONE}.
 */
public record Position(int line, int column, int endLine) {
    public static final Position NONE = new Position(0, 0);

    public Position(int line, int column) {
        this(line, column, line);
    }

    public static Position at(int line) {
        return new Position(line, 0);
    }

    public boolean isKnown() {
        return line > 0;
    }
}
