package im.arun.pyfmt.util;

import java.util.List;

/**
 * Column alignment of key/value pairs, as in {@code key   = value}.
 */
public final class Alignment {

    public record Pair(String first, String second) {
    }

    private Alignment() {}

    public static String align(List<Pair> pairs, String separator) {
        return align(pairs, separator, "\n", "");
    }

    /**
     * Pads every {@code first} to the widest one and joins
     * {@code first + separator + second + tail} with {@code joiner}.
     */
    public static String align(List<Pair> pairs, String separator, String joiner, String tail) {
        if (pairs == null || pairs.isEmpty()) {
            return "";
        }
        int width = 0;
        for (Pair pair : pairs) {
            width = Math.max(width, pair.first().length());
        }
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < pairs.size(); i++) {
            Pair pair = pairs.get(i);
            if (i > 0) {
                out.append(joiner);
            }
            out.append(pair.first())
                    .append(" ".repeat(width - pair.first().length()))
                    .append(separator)
                    .append(pair.second())
                    .append(tail);
        }
        return out.toString();
    }
}
