package im.arun.pyfmt.format;

import im.arun.pyfmt.comment.Comment;
import im.arun.pyfmt.comment.CommentCursor;
import im.arun.pyfmt.layout.LayoutContext;
import im.arun.pyfmt.layout.StringLiteralFormatter;
import im.arun.pyfmt.model.Alias;
import im.arun.pyfmt.model.Expr;
import im.arun.pyfmt.model.Position;
import im.arun.pyfmt.model.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Reorganizes one block into its fixed section order: docstring, standard-library imports,
 * other imports, constants, declarations, remaining content, then the comments that close
 * the block.
 *
 * <p>Only the leading run of each kind is reordered. The first statement that does not
 * belong to a section ends it, and everything from there on keeps its source order.
 */
public class BlockFormatter {
    private static final Logger logger = LoggerFactory.getLogger(BlockFormatter.class);

    private final NodeSerializer serializer;
    private final StringLiteralFormatter strings;

    public BlockFormatter(NodeSerializer serializer, StringLiteralFormatter strings) {
        this.serializer = serializer;
        this.strings = strings;
    }

    /**
     * Formats {@code body} under {@code ctx}, the context of the block's own indentation.
     * Unless {@code topLevel}, the result is indented one unit so that it reads relative to
     * the enclosing statement.
     */
    public String format(List<Stmt> body, LayoutContext ctx, boolean topLevel) {
        CommentCursor comments = ctx.getComments();
        int index = 0;

        List<String> docstring = new ArrayList<>();
        if (!body.isEmpty() && isDocstring(body.get(0))) {
            Stmt first = body.get(0);
            docstring.addAll(commentLines(comments.standaloneComments(first.line(), false)));
            // a comment after a multi-line docstring sits on its closing line
            Optional<Comment> inline = comments.inlineComment(first.position().endLine());
            String value = ((Expr.StringLiteral) ((Stmt.ExprStatement) first).value()).value();
            String text = docstring(value, ctx);
            // a comment can only follow the closing delimiter of a triple-quoted docstring
            int commentLine = text.startsWith("(") ? 0 : countLines(text) - 1;
            docstring.add(appendComment(text, inline, commentLine));
            index++;
        }

        Section standardImports = new Section();
        Section otherImports = new Section();
        while (index < body.size() && isImport(body.get(index))) {
            Stmt stmt = body.get(index++);
            List<Stmt> expanded = expandImport(stmt);
            Section section = isStandard(expanded.get(0)) ? standardImports : otherImports;
            section.comments.addAll(commentLines(comments.standaloneComments(stmt.line(), false)));
            Optional<Comment> inline = comments.inlineComment(stmt.line());
            for (int i = 0; i < expanded.size(); i++) {
                Stmt single = expanded.get(i);
                Section target = isStandard(single) ? standardImports : otherImports;
                String text = serializer.format(single, ctx);
                target.entries.add(new Entry(text, text, i == 0 ? inline : Optional.empty()));
            }
        }

        Section constants = new Section();
        while (index < body.size() && isConstant(body.get(index))) {
            Stmt stmt = body.get(index++);
            constants.comments.addAll(commentLines(comments.standaloneComments(stmt.line(), false)));
            Optional<Comment> inline = comments.inlineComment(stmt.line());
            String name = ((Expr.Name) ((Stmt.Assign) stmt).targets().get(0)).id();
            constants.entries.add(new Entry(name, serializer.format(stmt, ctx), inline));
        }

        List<String> declarations = new ArrayList<>();
        while (index < body.size() && isDeclaration(body.get(index))) {
            Stmt stmt = body.get(index++);
            declarations.addAll(commentLines(comments.standaloneComments(stmt.line(), false)));
            Optional<Comment> inline = comments.inlineComment(stmt.line());
            declarations.add(appendComment(serializer.format(stmt, ctx), inline));
        }

        List<String> content = new ArrayList<>();
        for (; index < body.size(); index++) {
            Stmt stmt = body.get(index);
            content.addAll(commentLines(comments.standaloneComments(stmt.line(), false)));
            Optional<Comment> inline = comments.inlineComment(stmt.line());
            String text = serializer.format(stmt, ctx);
            content.add(appendComment(text, inline, headerLine(stmt, text)));
            if (stmt instanceof Stmt.FunctionDef || stmt instanceof Stmt.ClassDef) {
                content.add("");
            }
        }

        List<Comment> closing = topLevel
                ? comments.remainingComments()
                : comments.trailingComments(body.isEmpty() ? 0 : body.get(body.size() - 1).line());

        logger.debug("Block sections: docstring={}, std imports={}, other imports={}, constants={}, "
                        + "declarations={}, content={}, closing comments={}",
                !docstring.isEmpty(), standardImports.entries.size(), otherImports.entries.size(),
                constants.entries.size(), declarations.size(), content.size(), closing.size());

        List<String> lines = new ArrayList<>();
        addSection(lines, docstring);
        addSection(lines, standardImports.render());
        addSection(lines, otherImports.render());
        addSection(lines, constants.render());
        lines.addAll(declarations);
        lines.addAll(content);
        lines.addAll(commentLines(closing));

        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        if (lines.isEmpty()) {
            if (topLevel) {
                return "";
            }
            lines.add("pass");
        }
        String text = String.join("\n", lines);
        return topLevel ? text : ctx.indentLines(text);
    }

    private static void addSection(List<String> lines, List<String> section) {
        if (!section.isEmpty()) {
            lines.addAll(section);
            lines.add("");
        }
    }

    private static List<String> commentLines(List<Comment> comments) {
        List<String> lines = new ArrayList<>(comments.size());
        for (Comment comment : comments) {
            lines.add(comment.text());
        }
        return lines;
    }

    private static String appendComment(String text, Optional<Comment> comment) {
        return appendComment(text, comment, 0);
    }

    /**
     * Puts {@code comment} at the end of line {@code lineIndex} of {@code text}.
     */
    private static String appendComment(String text, Optional<Comment> comment, int lineIndex) {
        if (comment.isEmpty()) {
            return text;
        }
        int start = 0;
        for (int i = 0; i < lineIndex; i++) {
            start = text.indexOf('\n', start) + 1;
        }
        int end = text.indexOf('\n', start);
        if (end < 0) {
            return text + " " + comment.get().text();
        }
        return text.substring(0, end) + " " + comment.get().text() + text.substring(end);
    }

    /**
     * Index of the rendered line holding a definition's {@code def}/{@code class} keyword,
     * past any decorators. Decorator continuation lines are indented or start with a bracket.
     */
    private static int headerLine(Stmt stmt, String text) {
        boolean decorated = (stmt instanceof Stmt.FunctionDef && !((Stmt.FunctionDef) stmt).decorators().isEmpty())
                || (stmt instanceof Stmt.ClassDef && !((Stmt.ClassDef) stmt).decorators().isEmpty());
        if (!decorated) {
            return 0;
        }
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].startsWith("def ") || lines[i].startsWith("async def ") || lines[i].startsWith("class ")) {
                return i;
            }
        }
        return 0;
    }

    private static int countLines(String text) {
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    // -- docstrings ---------------------------------------------------------------------

    private static boolean isDocstring(Stmt stmt) {
        return stmt instanceof Stmt.ExprStatement
                && ((Stmt.ExprStatement) stmt).value() instanceof Expr.StringLiteral;
    }

    private String docstring(String value, LayoutContext ctx) {
        String normalized = normalizeDocstring(value);
        if (normalized.indexOf('\n') < 0) {
            return strings.format(normalized, ctx);
        }
        String delimiter = ctx.getQuote().repeat(3);
        return delimiter + escapeDocstring(normalized, ctx.getQuote().charAt(0)) + delimiter;
    }

    /**
     * Strips trailing whitespace from every line and the common leading indentation from
     * every line after the first.
     */
    static String normalizeDocstring(String value) {
        String[] lines = value.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            lines[i] = lines[i].stripTrailing();
        }
        String common = null;
        for (int i = 1; i < lines.length; i++) {
            if (lines[i].isEmpty()) {
                continue;
            }
            String indent = leadingWhitespace(lines[i]);
            common = common == null ? indent : commonPrefix(common, indent);
        }
        if (common != null && !common.isEmpty()) {
            for (int i = 1; i < lines.length; i++) {
                if (!lines[i].isEmpty()) {
                    lines[i] = lines[i].substring(common.length());
                }
            }
        }
        return String.join("\n", lines);
    }

    private static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }

    private static String commonPrefix(String a, String b) {
        int i = 0;
        while (i < a.length() && i < b.length() && a.charAt(i) == b.charAt(i)) {
            i++;
        }
        return a.substring(0, i);
    }

    /**
     * Escapes a triple-quoted body: backslashes, control characters other than newline
     * and tab, and a quote that would close the literal early.
     */
    static String escapeDocstring(String value, char quote) {
        StringBuilder out = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\') {
                out.append("\\\\");
            } else if (c == quote) {
                boolean closesEarly = i == value.length() - 1
                        || (i + 2 < value.length() && value.charAt(i + 1) == quote && value.charAt(i + 2) == quote)
                        || (i > 0 && value.charAt(i - 1) == quote && i + 1 < value.length()
                                && value.charAt(i + 1) == quote);
                out.append(closesEarly ? "\\" + c : String.valueOf(c));
            } else if (c == '\r') {
                out.append("\\r");
            } else if (c < 0x20 && c != '\n' && c != '\t') {
                out.append(String.format("\\x%02x", (int) c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    // -- section membership -------------------------------------------------------------

    private static boolean isImport(Stmt stmt) {
        return stmt instanceof Stmt.Import || stmt instanceof Stmt.ImportFrom;
    }

    /**
     * One single-name import per imported name; the names carry no source position.
     */
    private static List<Stmt> expandImport(Stmt stmt) {
        List<Stmt> expanded = new ArrayList<>();
        if (stmt instanceof Stmt.Import) {
            for (Alias alias : ((Stmt.Import) stmt).names()) {
                expanded.add(new Stmt.Import(Position.NONE, List.of(alias)));
            }
        } else {
            Stmt.ImportFrom from = (Stmt.ImportFrom) stmt;
            for (Alias alias : from.names()) {
                expanded.add(new Stmt.ImportFrom(Position.NONE, from.module(), List.of(alias), from.level()));
            }
        }
        return expanded;
    }

    private static boolean isStandard(Stmt stmt) {
        if (stmt instanceof Stmt.Import) {
            return StandardModules.contains(((Stmt.Import) stmt).names().get(0).name());
        }
        Stmt.ImportFrom from = (Stmt.ImportFrom) stmt;
        return from.level() == 0 && from.module() != null && StandardModules.contains(from.module());
    }

    private static boolean isConstant(Stmt stmt) {
        return singleNameAssign(stmt) && isLiteral(((Stmt.Assign) stmt).value());
    }

    private static boolean isDeclaration(Stmt stmt) {
        if (!singleNameAssign(stmt)) {
            return false;
        }
        Expr value = ((Stmt.Assign) stmt).value();
        return isLiteral(value) || value instanceof Expr.Call;
    }

    private static boolean singleNameAssign(Stmt stmt) {
        return stmt instanceof Stmt.Assign
                && ((Stmt.Assign) stmt).targets().size() == 1
                && ((Stmt.Assign) stmt).targets().get(0) instanceof Expr.Name;
    }

    private static boolean isLiteral(Expr value) {
        return value instanceof Expr.StringLiteral
                || value instanceof Expr.NumberLiteral
                || value instanceof Expr.NameConstant;
    }

    /**
     * A sorted leading section. Standalone comments found inside it move to its top.
     */
    private static final class Section {
        private final List<String> comments = new ArrayList<>();
        private final List<Entry> entries = new ArrayList<>();

        List<String> render() {
            List<String> lines = new ArrayList<>(comments);
            entries.stream()
                    .sorted(Comparator.comparing(Entry::sortKey))
                    .forEach(entry -> lines.add(appendComment(entry.text(), entry.comment())));
            return lines;
        }
    }

    private record Entry(String sortKey, String text, Optional<Comment> comment) {
    }
}
