package im.arun.pyfmt.exception;

/**
 * Base of every fatal formatting failure. Nothing is written when one of these escapes.
 */
public class FormatterException extends RuntimeException {

    public FormatterException(String message) {
        super(message);
    }

    public FormatterException(String message, Throwable cause) {
        super(message, cause);
    }
}
