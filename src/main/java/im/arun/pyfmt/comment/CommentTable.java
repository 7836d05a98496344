package im.arun.pyfmt.comment;

import java.util.BitSet;

/**
 * Per-line view of a source file's comments and logical line structure, indexed by 1-based line.
 * Built once by {@link CommentScanner}; read-only afterwards.
 */
public final class CommentTable {
    private final Comment[] comments;
    private final BitSet statementStarts;
    private final BitSet continuationLines;
    private final int[] indents;

    CommentTable(Comment[] comments, BitSet statementStarts, BitSet continuationLines, int[] indents) {
        this.comments = comments;
        this.statementStarts = statementStarts;
        this.continuationLines = continuationLines;
        this.indents = indents;
    }

    public static CommentTable empty() {
        return new CommentTable(new Comment[1], new BitSet(), new BitSet(), new int[1]);
    }

    /**
     * One past the highest addressable line.
     */
    public int size() {
        return comments.length;
    }

    public Comment get(int line) {
        if (line <= 0 || line >= comments.length) {
            return null;
        }
        return comments[line];
    }

    public int count() {
        int total = 0;
        for (Comment comment : comments) {
            if (comment != null) {
                total++;
            }
        }
        return total;
    }

    public boolean isStatementStart(int line) {
        return line > 0 && statementStarts.get(line);
    }

    /**
     * First logical line starting at or after {@code from}, or -1.
     */
    public int nextStatementStart(int from) {
        return statementStarts.nextSetBit(Math.max(from, 0));
    }

    /**
     * First logical line after {@code line} indented no deeper than {@code line} itself, or -1.
     * Lines inside the bodies of a compound statement starting on {@code line} are skipped.
     */
    public int nextSiblingOrOuter(int line) {
        int indent = indentOf(line);
        int next = nextStatementStart(line + 1);
        while (next >= 0 && indentOf(next) > indent) {
            next = nextStatementStart(next + 1);
        }
        return next;
    }

    /**
     * True for lines that continue a logical line begun earlier (open bracket,
     * backslash or multi-line string).
     */
    public boolean isContinuation(int line) {
        return line > 0 && continuationLines.get(line);
    }

    public int indentOf(int line) {
        if (line <= 0 || line >= indents.length) {
            return 0;
        }
        return indents[line];
    }
}
