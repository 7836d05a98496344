package im.arun.pyfmt.comment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Optional;

/**
 * Monotonic reader over a {@link CommentTable}. Every comment is handed out at most once
 * and the read position never moves backwards.
 *
 * <p>One cursor belongs to exactly one formatting call; it is not thread-safe.
 */
public class CommentCursor {
    private static final Logger logger = LoggerFactory.getLogger(CommentCursor.class);

    private final CommentTable table;
    private final BitSet consumed = new BitSet();
    private int position = 1;

    public CommentCursor(CommentTable table) {
        this.table = table;
    }

    public static CommentCursor empty() {
        return new CommentCursor(CommentTable.empty());
    }

    public int position() {
        return position;
    }

    /**
     * Drains every unconsumed comment on a line before {@code line}.
     * With {@code allowDedent} false the drain stops, without consuming, at the first
     * comment that closes an enclosing block.
     */
    public List<Comment> standaloneComments(int line, boolean allowDedent) {
        List<Comment> results = new ArrayList<>();
        int start = position;
        int limit = Math.min(line, table.size());
        while (position < limit) {
            Comment comment = table.get(position);
            if (comment != null && !consumed.get(position)) {
                if (comment.dedent() && !allowDedent) {
                    logger.debug("Holding dedent comment at line {} back from line {}", position, line);
                    break;
                }
                results.add(comment);
                consumed.set(position);
            }
            position++;
        }
        if (start != position) {
            logger.debug("Advanced comment cursor to {}", position);
        }
        return results;
    }

    /**
     * The comment that trails code on {@code line}, if it is still available.
     */
    public Optional<Comment> inlineComment(int line) {
        if (line < position) {
            return Optional.empty();
        }
        Comment comment = table.get(line);
        if (comment == null || comment.dedent() || consumed.get(line)) {
            return Optional.empty();
        }
        consumed.set(line);
        if (position == line) {
            position++;
        }
        return Optional.of(comment);
    }

    /**
     * Comments that end the block whose last statement starts on {@code lastLine}:
     * comments inside that statement's continuation lines and dedent comments closing
     * a block at least as deep as that statement. Stops at the next logical line that is
     * not nested inside that statement.
     */
    public List<Comment> trailingComments(int lastLine) {
        List<Comment> results = new ArrayList<>();
        if (lastLine <= 0) {
            return results;
        }
        int next = table.nextSiblingOrOuter(lastLine);
        int limit = next < 0 ? table.size() : next;
        int blockIndent = table.indentOf(lastLine);
        while (position < limit) {
            Comment comment = table.get(position);
            if (comment != null && !consumed.get(position)) {
                boolean belongs = position <= lastLine
                        || table.isContinuation(position)
                        || (comment.dedent() && comment.level() >= blockIndent);
                if (!belongs) {
                    break;
                }
                results.add(comment);
                consumed.set(position);
            }
            position++;
        }
        return results;
    }

    /**
     * Everything not yet handed out, in source order.
     */
    public List<Comment> remainingComments() {
        List<Comment> results = new ArrayList<>();
        for (int line = 1; line < table.size(); line++) {
            Comment comment = table.get(line);
            if (comment != null && !consumed.get(line)) {
                results.add(comment);
                consumed.set(line);
            }
        }
        position = table.size();
        return results;
    }
}
