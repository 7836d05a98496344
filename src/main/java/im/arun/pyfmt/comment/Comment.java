package im.arun.pyfmt.comment;

/**
 * One {@code #} comment found in the raw source.
 *
 * @param line   1-based source line
 * @param column visual column of the {@code #}, tabs expanded to multiples of eight
 * @param text   the comment including its {@code #}, trailing whitespace stripped
 * @param dedent true when the comment closes the block above it instead of prefixing the next statement
 * @param level  indentation of the block a dedent comment closes; equals {@code column} otherwise
 */
public record Comment(int line, int column, String text, boolean dedent, int level) {

    public static Comment of(int line, int column, String text) {
        return new Comment(line, column, text, false, column);
    }

    Comment closing(int blockLevel) {
        return new Comment(line, column, text, true, blockLevel);
    }
}
