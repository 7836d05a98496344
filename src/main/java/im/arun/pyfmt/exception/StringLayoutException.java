package im.arun.pyfmt.exception;

/**
 * A string literal holds a token too long to fit any line at the configured width.
 */
public class StringLayoutException extends FormatterException {
    private final String token;
    private final int maxLineLength;

    public StringLayoutException(String token, int maxLineLength) {
        super("Cannot lay out string token of length " + token.length()
                + " within " + maxLineLength + " columns: " + abbreviate(token));
        this.token = token;
        this.maxLineLength = maxLineLength;
    }

    public String getToken() {
        return token;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    private static String abbreviate(String token) {
        return token.length() <= 40 ? token : token.substring(0, 37) + "...";
    }
}
