package im.arun.pyfmt.layout;

import im.arun.pyfmt.exception.StringLayoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Renders string literals, reflowing long ones into a parenthesized run of adjacent literals.
 *
 * <p>Strategies are tried in order: the direct single literal, then wrapping at spaces.
 * When neither fits, the literal holds a token no line can carry and formatting fails.
 */
public class StringLiteralFormatter {
    private static final Logger logger = LoggerFactory.getLogger(StringLiteralFormatter.class);

    /** Splits after a newline, or after a run of spaces before the next word. */
    private static final Pattern BREAKS = Pattern.compile("(?<=\n)|(?<= )(?=[^ ])");

    public String format(String value, LayoutContext ctx) {
        String direct = quoted(value, ctx.getQuote());
        if (ctx.isInline() || direct.length() <= ctx.remainingLineLength()) {
            return direct;
        }
        Optional<String> wrapped = spaceWrap(value, ctx);
        if (wrapped.isPresent()) {
            logger.debug("Wrapped string literal of length {} at indent {}", value.length(), ctx.getIndent());
            return wrapped.get();
        }
        throw new StringLayoutException(longestToken(value), ctx.getMaxLineLength());
    }

    public static String quoted(String value, String quote) {
        return quote + escape(value, quote) + quote;
    }

    public static String escape(String value, String quote) {
        StringBuilder out = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\':
                    out.append("\\\\");
                    break;
                case '\n':
                    out.append("\\n");
                    break;
                case '\t':
                    out.append("\\t");
                    break;
                case '\r':
                    out.append("\\r");
                    break;
                default:
                    if (quote.indexOf(c) >= 0) {
                        out.append('\\').append(c);
                    } else if (c < 0x20 || c == 0x7f) {
                        out.append(String.format("\\x%02x", (int) c));
                    } else {
                        out.append(c);
                    }
            }
        }
        return out.toString();
    }

    private Optional<String> spaceWrap(String value, LayoutContext ctx) {
        String quote = ctx.getQuote();
        int limit = ctx.getMaxLineLength() - (ctx.getIndent() + 1) * ctx.tabWidth();
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String piece : BREAKS.split(value)) {
            if (piece.isEmpty()) {
                continue;
            }
            if (quoted(piece, quote).length() > limit) {
                return Optional.empty();
            }
            String candidate = current + piece;
            if (current.length() > 0 && quoted(candidate, quote).length() > limit) {
                segments.add(current.toString());
                current.setLength(0);
            }
            current.append(piece);
            if (piece.endsWith("\n")) {
                segments.add(current.toString());
                current.setLength(0);
            }
        }
        if (current.length() > 0) {
            segments.add(current.toString());
        }
        if (segments.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder out = new StringBuilder("(");
        for (String segment : segments) {
            out.append('\n').append(ctx.getTab()).append(quoted(segment, quote));
        }
        return Optional.of(out.append("\n)").toString());
    }

    private static String longestToken(String value) {
        String longest = "";
        for (String token : BREAKS.split(value)) {
            if (token.length() > longest.length()) {
                longest = token;
            }
        }
        return longest;
    }
}
