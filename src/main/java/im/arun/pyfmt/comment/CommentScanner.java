package im.arun.pyfmt.comment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

/**
 * Single lexical pass over Python source that finds every comment and every logical line.
 *
 * <p>Strings (including triple-quoted ones), bracket nesting and backslash continuations
 * are tracked so that a {@code #} inside a literal is never mistaken for a comment.
 * Comment-only lines that sit between the end of an indented block and a following,
 * less indented line are classified as dedent comments: they close the block above.
 */
public class CommentScanner {
    private static final Logger logger = LoggerFactory.getLogger(CommentScanner.class);
    private static final int TAB_STOP = 8;

    public CommentTable scan(String source) {
        String[] lines = source.split("\r?\n", -1);
        Scan scan = new Scan(lines.length);
        for (int i = 0; i < lines.length; i++) {
            scan.line(i + 1, lines[i]);
        }
        scan.finish();
        CommentTable table = new CommentTable(scan.comments, scan.statementStarts, scan.continuationLines, scan.indents);
        logger.debug("Scanned {} lines, found {} comments", lines.length, table.count());
        return table;
    }

    static int visualWidth(String text, int end) {
        int width = 0;
        for (int i = 0; i < end; i++) {
            if (text.charAt(i) == '\t') {
                width = (width / TAB_STOP + 1) * TAB_STOP;
            } else {
                width++;
            }
        }
        return width;
    }

    private static int indentation(String text) {
        int end = 0;
        while (end < text.length() && (text.charAt(end) == ' ' || text.charAt(end) == '\t' || text.charAt(end) == '\f')) {
            end++;
        }
        return visualWidth(text, end);
    }

    /**
     * Mutable state of one scan.
     */
    private static final class Scan {
        final Comment[] comments;
        final BitSet statementStarts = new BitSet();
        final BitSet continuationLines = new BitSet();
        final int[] indents;
        final Deque<Integer> indentStack = new ArrayDeque<>();
        final List<Integer> pending = new ArrayList<>();

        String quote;
        boolean stringContinued;
        boolean lineContinued;
        int depth;

        Scan(int lineCount) {
            comments = new Comment[lineCount + 1];
            indents = new int[lineCount + 1];
            indentStack.push(0);
        }

        void line(int lineNo, String text) {
            boolean startedInString = quote != null;
            boolean logicalStart = !startedInString && depth == 0 && !lineContinued;
            if (!logicalStart) {
                continuationLines.set(lineNo);
            }
            lineContinued = false;
            stringContinued = false;

            boolean code = false;
            int length = text.length();
            int j = 0;
            while (j < length) {
                if (quote != null) {
                    j = skipString(text, j);
                    continue;
                }
                char c = text.charAt(j);
                if (c == '#') {
                    comments[lineNo] = Comment.of(lineNo, visualWidth(text, j), text.substring(j).stripTrailing());
                    break;
                }
                if (c == '\'' || c == '"') {
                    code = true;
                    String triple = String.valueOf(c).repeat(3);
                    quote = text.startsWith(triple, j) ? triple : String.valueOf(c);
                    j += quote.length();
                    continue;
                }
                if (c == '\\' && j == length - 1) {
                    lineContinued = true;
                    j++;
                    continue;
                }
                if (c == '(' || c == '[' || c == '{') {
                    depth++;
                } else if (c == ')' || c == ']' || c == '}') {
                    depth = Math.max(0, depth - 1);
                }
                if (!Character.isWhitespace(c)) {
                    code = true;
                }
                j++;
            }
            if (quote != null && quote.length() == 1 && !stringContinued) {
                // unterminated single-quoted string; recover at end of line
                quote = null;
            }

            if (!logicalStart) {
                return;
            }
            if (code) {
                int indent = indentation(text);
                statementStarts.set(lineNo);
                indents[lineNo] = indent;
                closeBlocks(indent);
            } else if (comments[lineNo] != null) {
                pending.add(lineNo);
            }
        }

        void finish() {
            closeBlocks(0);
        }

        private int skipString(String text, int j) {
            int length = text.length();
            while (j < length) {
                char c = text.charAt(j);
                if (c == '\\') {
                    if (j + 1 < length) {
                        j += 2;
                    } else {
                        stringContinued = true;
                        j = length;
                    }
                } else if (text.startsWith(quote, j)) {
                    j += quote.length();
                    quote = null;
                    return j;
                } else {
                    j++;
                }
            }
            return length;
        }

        /**
         * Pops every indentation level deeper than {@code indent} and marks the pending
         * comment-only lines that belong to one of the closed blocks.
         */
        private void closeBlocks(int indent) {
            List<Integer> closed = new ArrayList<>();
            while (indentStack.peek() > indent) {
                closed.add(indentStack.pop());
            }
            if (indentStack.peek() < indent) {
                indentStack.push(indent);
            }
            if (!closed.isEmpty() && !pending.isEmpty()) {
                markDedent(closed);
            }
            pending.clear();
        }

        private void markDedent(List<Integer> closed) {
            int outermost = closed.get(closed.size() - 1);
            int[] levels = new int[pending.size()];
            int last = -1;
            for (int i = 0; i < pending.size(); i++) {
                int column = comments[pending.get(i)].column();
                levels[i] = -1;
                if (column >= outermost) {
                    // closed is ordered deepest first
                    for (int level : closed) {
                        if (level <= column) {
                            levels[i] = level;
                            break;
                        }
                    }
                    last = i;
                }
            }
            // earlier comments attach no shallower than later ones so output order is kept
            int attach = -1;
            for (int i = last; i >= 0; i--) {
                attach = Math.max(attach, levels[i]);
                int line = pending.get(i);
                comments[line] = comments[line].closing(attach);
            }
        }
    }
}
