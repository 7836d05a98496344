package im.arun.pyfmt.exception;

import java.io.IOException;

/**
 * The parsed-tree document could not be read: malformed JSON or a missing field.
 */
public class TreeParseException extends IOException {

    public TreeParseException(String message) {
        super(message);
    }

    public TreeParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
