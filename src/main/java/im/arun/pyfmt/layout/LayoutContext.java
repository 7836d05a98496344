package im.arun.pyfmt.layout;

import im.arun.pyfmt.comment.CommentCursor;
import im.arun.pyfmt.config.FormatterConfig;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Layout budget threaded through every formatting call.
 *
 * <p>Widths are measured in characters, the indentation unit counting as its own length.
 * {@code reservedWidth} is the absolute column already used on the current output line,
 * indentation included. Multi-line text produced under a context expresses its continuation
 * lines relative to that context's indentation; the enclosing block adds the rest.
 *
 * <p>Instances are immutable. The {@link CommentCursor} is the one shared, mutable part and is
 * the same object in every context derived from a root.
 */
@Value
@Builder(toBuilder = true)
public class LayoutContext {
    int maxLineLength;
    int reservedWidth;
    int indent;
    @With
    String quote;
    String tab;
    @With
    boolean inline;
    @With
    boolean suppressTupleParens;
    CommentCursor comments;

    public static LayoutContext root(FormatterConfig config, CommentCursor comments) {
        return LayoutContext.builder()
                .maxLineLength(config.getMaxLineLength())
                .reservedWidth(0)
                .indent(0)
                .quote(config.getQuote())
                .tab(config.getTab())
                .comments(comments)
                .build();
    }

    public int tabWidth() {
        return tab.length();
    }

    public int indentWidth() {
        return indent * tab.length();
    }

    public int remainingLineLength() {
        return maxLineLength - reservedWidth;
    }

    /**
     * Width already committed on the current line past the indentation.
     */
    public int offset() {
        return reservedWidth - indentWidth();
    }

    /**
     * Context for a sub-node that continues the current line after {@code prefixLength}
     * characters (not counting indentation).
     */
    public LayoutContext reserve(int prefixLength) {
        return toBuilder().reservedWidth(indentWidth() + prefixLength).build();
    }

    /**
     * Like {@link #reserve(int)} with the length of the last line of {@code prefix}.
     */
    public LayoutContext reserveText(String prefix) {
        return reserve(lastLine(prefix).length());
    }

    /**
     * Moves the reservation further along the current line.
     */
    public LayoutContext advance(int length) {
        return reserve(offset() + length);
    }

    public LayoutContext advanceText(String text) {
        if (text.indexOf('\n') >= 0) {
            return reserveText(text);
        }
        return advance(text.length());
    }

    /**
     * One level deeper, starting a fresh line.
     */
    public LayoutContext enterScope() {
        return toBuilder()
                .indent(indent + 1)
                .reservedWidth((indent + 1) * tab.length())
                .build();
    }

    /**
     * Keeps {@code suffixLength} characters free at the end of the current line.
     */
    public LayoutContext narrow(int suffixLength) {
        return toBuilder().maxLineLength(maxLineLength - suffixLength).build();
    }

    /**
     * Whether {@code text}, placed at the reserved position, stays within the limits:
     * the first line within the remaining budget, every other line within the maximum
     * once indentation is added.
     */
    public boolean fits(String text) {
        int newline = text.indexOf('\n');
        if (newline < 0) {
            return text.length() <= remainingLineLength();
        }
        if (newline > remainingLineLength()) {
            return false;
        }
        for (String line : text.substring(newline + 1).split("\n", -1)) {
            if (indentWidth() + line.length() > maxLineLength) {
                return false;
            }
        }
        return true;
    }

    /**
     * Prefixes every non-empty line with one indentation unit.
     */
    public String indentLines(String text) {
        StringBuilder out = new StringBuilder(text.length() + 16);
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append('\n');
            }
            if (!lines[i].isEmpty()) {
                out.append(tab).append(lines[i]);
            }
        }
        return out.toString();
    }

    public static String lastLine(String text) {
        return text.substring(text.lastIndexOf('\n') + 1);
    }

    public static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline);
    }
}
