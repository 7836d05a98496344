package im.arun.pyfmt.format;

import im.arun.pyfmt.layout.LayoutContext;
import im.arun.pyfmt.layout.StringLiteralFormatter;
import im.arun.pyfmt.model.Alias;
import im.arun.pyfmt.model.Arg;
import im.arun.pyfmt.model.Arguments;
import im.arun.pyfmt.model.BinaryOperator;
import im.arun.pyfmt.model.Comprehension;
import im.arun.pyfmt.model.ExceptHandler;
import im.arun.pyfmt.model.Expr;
import im.arun.pyfmt.model.Keyword;
import im.arun.pyfmt.model.Module;
import im.arun.pyfmt.model.Node;
import im.arun.pyfmt.model.NodeVisitor;
import im.arun.pyfmt.model.Precedence;
import im.arun.pyfmt.model.Stmt;
import im.arun.pyfmt.model.WithItem;
import im.arun.pyfmt.util.Alignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders any node to text under a {@link LayoutContext}.
 *
 * <p>Layout-sensitive constructs (calls, collections, comprehensions, operator chains,
 * lambdas) first try a single-line rendering with every child in inline mode. When that
 * does not fit the remaining budget they switch to an expanded rendering with one item per
 * indented line. Inline mode never expands, so the compact attempt is linear in the size of
 * the subtree.
 *
 * <p>Multi-line results express continuation lines relative to the context's indentation.
 * Block bodies are delegated to {@link BlockFormatter}, which calls back into this class
 * for each statement.
 *
 * <p>The serializer holds no per-call state and may be shared between threads; each call
 * must bring its own context.
 */
public class NodeSerializer implements NodeVisitor<String, LayoutContext> {
    private static final Logger logger = LoggerFactory.getLogger(NodeSerializer.class);
    private static final Pattern DECIMAL_INTEGER = Pattern.compile("[0-9_]+");

    private final StringLiteralFormatter strings;
    private final SignatureFormatter signatures;
    private final BlockFormatter blocks;

    public NodeSerializer() {
        this.strings = new StringLiteralFormatter();
        this.signatures = new SignatureFormatter(this);
        this.blocks = new BlockFormatter(this, strings);
    }

    /**
     * Renders {@code node}. Tuple-parenthesis suppression only ever applies to the node it
     * was requested for, never to anything nested below a non-tuple.
     */
    public String format(Node node, LayoutContext ctx) {
        if (ctx.isSuppressTupleParens() && !(node instanceof Expr.TupleLiteral)) {
            ctx = ctx.withSuppressTupleParens(false);
        }
        return node.accept(this, ctx);
    }

    /**
     * Renders {@code expr} into a slot that binds at least as tightly as {@code minPrecedence},
     * adding parentheses when the expression binds more loosely.
     */
    public String format(Expr expr, int minPrecedence, LayoutContext ctx) {
        if (expr.precedence() >= minPrecedence) {
            return format(expr, ctx);
        }
        return "(" + format(expr, ctx.advance(1).withSuppressTupleParens(false)) + ")";
    }

    public String formatModule(Module module, LayoutContext ctx) {
        return blocks.format(module.body(), ctx, true);
    }

    String block(List<Stmt> body, LayoutContext ctx) {
        return blocks.format(body, ctx.enterScope(), false);
    }

    private static String inlineComment(int line, LayoutContext ctx) {
        if (line <= 0) {
            return "";
        }
        return ctx.getComments().inlineComment(line).map(comment -> " " + comment.text()).orElse("");
    }

    // -- argument lists -----------------------------------------------------------------

    /**
     * Lays out {@code head(args, keywords)} for calls and class headers.
     *
     * <ol>
     *   <li>everything on one line;</li>
     *   <li>positional arguments only: the first beside the parenthesis, the rest one per
     *       indented line;</li>
     *   <li>one argument per indented line, keywords sorted and aligned on {@code =}.</li>
     * </ol>
     */
    String formatArgumentList(String head, List<Expr> args, List<Keyword> keywords, LayoutContext ctx) {
        if (args.isEmpty() && keywords.isEmpty()) {
            return head + "()";
        }
        Optional<String> compact = compactArguments(head, args, keywords, ctx);
        if (compact.isPresent()) {
            return compact.get();
        }
        if (!args.isEmpty() && keywords.isEmpty()) {
            Optional<String> hanging = hangingArguments(head, args, ctx);
            if (hanging.isPresent()) {
                logger.debug("Hanging layout for {} arguments of {}", args.size(), LayoutContext.firstLine(head));
                return hanging.get();
            }
        }
        logger.debug("Vertical layout for arguments of {}", LayoutContext.firstLine(head));
        return verticalArguments(head, args, keywords, ctx);
    }

    private Optional<String> compactArguments(String head, List<Expr> args, List<Keyword> keywords, LayoutContext ctx) {
        Line line = new Line(ctx.withInline(true)).text(head);
        if (args.size() == 1 && keywords.isEmpty() && args.get(0) instanceof Expr.GeneratorExp) {
            // a lone generator argument shares the call's parentheses
            line.text(format(args.get(0), line.context()));
        } else {
            line.text("(");
            boolean first = true;
            for (Expr arg : args) {
                if (!first) {
                    line.text(", ");
                }
                line.text(argument(arg, line.context()));
                first = false;
            }
            for (Keyword keyword : keywords) {
                if (!first) {
                    line.text(", ");
                }
                line.text(format(keyword, line.context()));
                first = false;
            }
            line.text(")");
        }
        String text = line.build();
        if (ctx.isInline() || ctx.fits(text)) {
            return Optional.of(text);
        }
        return Optional.empty();
    }

    private Optional<String> hangingArguments(String head, List<Expr> args, LayoutContext ctx) {
        Line line = new Line(ctx).text(head + "(");
        String first = argument(args.get(0), line.context());
        if (first.indexOf('\n') >= 0) {
            return Optional.empty();
        }
        String opening = head + "(" + first + (args.size() == 1 ? ")" : ",");
        if (!ctx.fits(opening)) {
            return Optional.empty();
        }
        // every later argument is followed by "," or ")"
        LayoutContext scope = ctx.enterScope().narrow(1);
        StringBuilder out = new StringBuilder(opening);
        for (int i = 1; i < args.size(); i++) {
            out.append('\n')
                    .append(ctx.indentLines(argument(args.get(i), scope)))
                    .append(i == args.size() - 1 ? ")" : ",");
        }
        return Optional.of(out.toString());
    }

    private String verticalArguments(String head, List<Expr> args, List<Keyword> keywords, LayoutContext ctx) {
        LayoutContext scope = ctx.enterScope();
        LayoutContext item = scope.narrow(1);
        List<String> entries = new ArrayList<>();
        for (Expr arg : args) {
            entries.add(argument(arg, item) + ",");
        }
        List<Keyword> named = keywords.stream()
                .filter(keyword -> !keyword.isSplat())
                .sorted(Comparator.comparing(Keyword::arg))
                .collect(Collectors.toList());
        if (!named.isEmpty()) {
            int width = named.stream().mapToInt(keyword -> keyword.arg().length()).max().orElse(0);
            LayoutContext valueCtx = item.reserve(width + 3);
            List<Alignment.Pair> pairs = new ArrayList<>();
            for (Keyword keyword : named) {
                pairs.add(new Alignment.Pair(keyword.arg(), format(keyword.value(), Precedence.LAMBDA, valueCtx)));
            }
            entries.add(Alignment.align(pairs, " = ", "\n", ","));
        }
        for (Keyword keyword : keywords) {
            if (keyword.isSplat()) {
                entries.add("**" + format(keyword.value(), Precedence.BIT_OR, item.reserve(2)) + ",");
            }
        }
        return head + "(\n" + ctx.indentLines(String.join("\n", entries)) + "\n)";
    }

    private String argument(Expr arg, LayoutContext ctx) {
        return format(arg, Precedence.LAMBDA, ctx);
    }

    /**
     * Context for item {@code index} of {@code count} one per line: all but the last are
     * followed by a comma.
     */
    static LayoutContext separated(LayoutContext ctx, int index, int count) {
        return index < count - 1 ? ctx.narrow(1) : ctx;
    }

    // -- collections ----------------------------------------------------------------------

    private String sequence(String open, String close, List<Expr> elements, String tail, LayoutContext ctx) {
        Line line = new Line(ctx.withInline(true)).text(open);
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                line.text(", ");
            }
            line.expr(elements.get(i), Precedence.LAMBDA);
        }
        String compact = line.text(tail).text(close).build();
        if (ctx.isInline() || ctx.fits(compact)) {
            return compact;
        }
        LayoutContext scope = ctx.enterScope();
        List<String> items = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            int suffix = i < elements.size() - 1 ? 1 : tail.length();
            items.add(format(elements.get(i), Precedence.LAMBDA, scope.narrow(suffix)));
        }
        return open + "\n" + ctx.indentLines(String.join(",\n", items) + tail) + "\n" + close;
    }

    private String comprehension(
            String open,
            Function<LayoutContext, String> element,
            List<Comprehension> generators,
            String close,
            LayoutContext ctx
    ) {
        Line line = new Line(ctx.withInline(true)).text(open);
        line.text(element.apply(line.context()));
        for (Comprehension generator : generators) {
            line.text(" ").text(format(generator, line.context()));
        }
        String compact = line.text(close).build();
        if (ctx.isInline() || ctx.fits(compact)) {
            return compact;
        }
        LayoutContext scope = ctx.enterScope();
        List<String> lines = new ArrayList<>();
        lines.add(element.apply(scope));
        for (Comprehension generator : generators) {
            lines.addAll(clauses(generator, scope));
        }
        return open + "\n" + ctx.indentLines(String.join("\n", lines)) + "\n" + close;
    }

    private List<String> clauses(Comprehension generator, LayoutContext ctx) {
        List<String> lines = new ArrayList<>();
        Line head = new Line(ctx).text(generator.async() ? "async for " : "for ");
        head.bare(generator.target(), Precedence.BIT_OR).text(" in ").expr(generator.iter(), Precedence.OR);
        lines.add(head.build());
        for (Expr condition : generator.ifs()) {
            lines.add(new Line(ctx).text("if ").expr(condition, Precedence.OR).build());
        }
        return lines;
    }

    // -- operator chains ------------------------------------------------------------------

    private String chain(List<Expr> operands, List<String> symbols, List<Integer> minimums, LayoutContext ctx) {
        Line line = new Line(ctx.withInline(true)).expr(operands.get(0), minimums.get(0));
        for (int i = 1; i < operands.size(); i++) {
            line.text(" " + symbols.get(i - 1) + " ").expr(operands.get(i), minimums.get(i));
        }
        String compact = line.build();
        if (ctx.isInline() || ctx.fits(compact)) {
            return compact;
        }
        logger.debug("Breaking operator chain of {} operands", operands.size());
        LayoutContext scope = ctx.enterScope();
        List<String> lines = new ArrayList<>();
        lines.add(format(operands.get(0), minimums.get(0), scope));
        for (int i = 1; i < operands.size(); i++) {
            String symbol = symbols.get(i - 1) + " ";
            lines.add(symbol + format(operands.get(i), minimums.get(i), scope.reserve(symbol.length())));
        }
        return "(\n" + ctx.indentLines(String.join("\n", lines)) + "\n)";
    }

    private static void flatten(Expr.BinOp node, List<Expr> operands, List<BinaryOperator> ops) {
        if (!node.op().isRightAssociative()
                && node.left() instanceof Expr.BinOp
                && ((Expr.BinOp) node.left()).precedence() == node.precedence()) {
            flatten((Expr.BinOp) node.left(), operands, ops);
        } else {
            operands.add(node.left());
        }
        ops.add(node.op());
        operands.add(node.right());
    }

    // -- expressions ----------------------------------------------------------------------

    @Override
    public String visitStringLiteral(Expr.StringLiteral node, LayoutContext ctx) {
        return strings.format(node.value(), ctx);
    }

    @Override
    public String visitNumberLiteral(Expr.NumberLiteral node, LayoutContext ctx) {
        return node.text();
    }

    @Override
    public String visitNameConstant(Expr.NameConstant node, LayoutContext ctx) {
        return node.text();
    }

    @Override
    public String visitName(Expr.Name node, LayoutContext ctx) {
        return node.id();
    }

    @Override
    public String visitAttribute(Expr.Attribute node, LayoutContext ctx) {
        String value;
        if (node.value() instanceof Expr.NumberLiteral
                && DECIMAL_INTEGER.matcher(((Expr.NumberLiteral) node.value()).text()).matches()) {
            // 1.real would lex as a float
            value = "(" + ((Expr.NumberLiteral) node.value()).text() + ")";
        } else {
            value = format(node.value(), Precedence.ATOM, ctx);
        }
        return value + "." + node.attr();
    }

    @Override
    public String visitSubscript(Expr.Subscript node, LayoutContext ctx) {
        return new Line(ctx)
                .expr(node.value(), Precedence.ATOM)
                .text("[")
                .bare(node.slice(), Precedence.LAMBDA)
                .text("]")
                .build();
    }

    @Override
    public String visitSlice(Expr.Slice node, LayoutContext ctx) {
        Line line = new Line(ctx);
        if (node.lower() != null) {
            line.expr(node.lower(), Precedence.IF_EXP);
        }
        line.text(":");
        if (node.upper() != null) {
            line.expr(node.upper(), Precedence.IF_EXP);
        }
        if (node.step() != null) {
            line.text(":").expr(node.step(), Precedence.IF_EXP);
        }
        return line.build();
    }

    @Override
    public String visitCall(Expr.Call node, LayoutContext ctx) {
        String head = format(node.func(), Precedence.ATOM, ctx);
        return formatArgumentList(head, node.args(), node.keywords(), ctx);
    }

    @Override
    public String visitStarred(Expr.Starred node, LayoutContext ctx) {
        return "*" + format(node.value(), Precedence.BIT_OR, ctx.advance(1));
    }

    @Override
    public String visitUnaryOp(Expr.UnaryOp node, LayoutContext ctx) {
        String symbol = node.op().symbol();
        return symbol + format(node.operand(), node.op().precedence(), ctx.advance(symbol.length()));
    }

    @Override
    public String visitBinOp(Expr.BinOp node, LayoutContext ctx) {
        List<Expr> operands = new ArrayList<>();
        List<BinaryOperator> ops = new ArrayList<>();
        flatten(node, operands, ops);
        List<String> symbols = new ArrayList<>();
        List<Integer> minimums = new ArrayList<>();
        int precedence = node.precedence();
        if (node.op().isRightAssociative()) {
            minimums.add(Precedence.POWER + 1);
            minimums.add(Precedence.FACTOR);
        } else {
            minimums.add(precedence);
            for (int i = 1; i < operands.size(); i++) {
                minimums.add(precedence + 1);
            }
        }
        for (BinaryOperator op : ops) {
            symbols.add(op.symbol());
        }
        return chain(operands, symbols, minimums, ctx);
    }

    @Override
    public String visitBoolOp(Expr.BoolOp node, LayoutContext ctx) {
        List<String> symbols = new ArrayList<>();
        List<Integer> minimums = new ArrayList<>();
        for (int i = 0; i < node.values().size(); i++) {
            minimums.add(node.precedence() + 1);
            if (i > 0) {
                symbols.add(node.op().symbol());
            }
        }
        return chain(node.values(), symbols, minimums, ctx);
    }

    @Override
    public String visitCompare(Expr.Compare node, LayoutContext ctx) {
        Line line = new Line(ctx).expr(node.left(), Precedence.BIT_OR);
        for (int i = 0; i < node.ops().size(); i++) {
            line.text(" " + node.ops().get(i).symbol() + " ").expr(node.comparators().get(i), Precedence.BIT_OR);
        }
        return line.build();
    }

    @Override
    public String visitIfExp(Expr.IfExp node, LayoutContext ctx) {
        return new Line(ctx)
                .expr(node.body(), Precedence.OR)
                .text(" if ")
                .expr(node.test(), Precedence.OR)
                .text(" else ")
                .expr(node.orelse(), Precedence.LAMBDA)
                .build();
    }

    @Override
    public String visitLambda(Expr.Lambda node, LayoutContext ctx) {
        String parameters = signatures.formatLambda(node.args(), ctx.advance(7));
        String head = parameters.isEmpty() ? "lambda: " : "lambda " + parameters + ": ";
        String compact = head + format(node.body(), Precedence.LAMBDA, ctx.withInline(true).advanceText(head));
        if (ctx.isInline() || ctx.fits(compact)) {
            return compact;
        }
        String body = format(node.body(), Precedence.LAMBDA, ctx.enterScope());
        return head + "(\n" + ctx.indentLines(body) + "\n)";
    }

    @Override
    public String visitNamedExpr(Expr.NamedExpr node, LayoutContext ctx) {
        return new Line(ctx)
                .text("(")
                .expr(node.target(), Precedence.ATOM)
                .text(" := ")
                .expr(node.value(), Precedence.LAMBDA)
                .text(")")
                .build();
    }

    @Override
    public String visitListLiteral(Expr.ListLiteral node, LayoutContext ctx) {
        return sequence("[", "]", node.elements(), "", ctx);
    }

    @Override
    public String visitTupleLiteral(Expr.TupleLiteral node, LayoutContext ctx) {
        List<Expr> elements = node.elements();
        if (elements.isEmpty()) {
            return "()";
        }
        String tail = elements.size() == 1 ? "," : "";
        if (!ctx.isSuppressTupleParens()) {
            return sequence("(", ")", elements, tail, ctx);
        }
        LayoutContext plain = ctx.withSuppressTupleParens(false);
        Line line = new Line(plain.withInline(true));
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                line.text(", ");
            }
            line.expr(elements.get(i), Precedence.LAMBDA);
        }
        String bare = line.text(tail).build();
        if (ctx.isInline() || ctx.fits(bare)) {
            return bare;
        }
        return sequence("(", ")", elements, tail, plain);
    }

    @Override
    public String visitSetLiteral(Expr.SetLiteral node, LayoutContext ctx) {
        if (node.elements().isEmpty()) {
            return "set()";
        }
        return sequence("{", "}", node.elements(), "", ctx);
    }

    @Override
    public String visitDictLiteral(Expr.DictLiteral node, LayoutContext ctx) {
        if (node.keys().isEmpty()) {
            return "{}";
        }
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < node.keys().size(); i++) {
            order.add(i);
        }
        boolean unpacking = node.keys().contains(null);
        LayoutContext inline = ctx.withInline(true);
        if (!unpacking) {
            List<String> keyTexts = new ArrayList<>();
            for (Expr key : node.keys()) {
                keyTexts.add(format(key, Precedence.IF_EXP, inline));
            }
            order.sort(Comparator.comparing(keyTexts::get));
        }

        Line line = new Line(inline).text("{");
        for (int n = 0; n < order.size(); n++) {
            int i = order.get(n);
            if (n > 0) {
                line.text(", ");
            }
            Expr key = node.keys().get(i);
            if (key == null) {
                line.text("**").expr(node.values().get(i), Precedence.BIT_OR);
            } else {
                line.expr(key, Precedence.IF_EXP).text(": ").expr(node.values().get(i), Precedence.LAMBDA);
            }
        }
        String compact = line.text("}").build();
        if (ctx.isInline() || ctx.fits(compact)) {
            return compact;
        }

        LayoutContext scope = ctx.enterScope();
        String body;
        if (unpacking) {
            List<String> entries = new ArrayList<>();
            for (int n = 0; n < order.size(); n++) {
                int i = order.get(n);
                LayoutContext item = separated(scope, n, order.size());
                Expr key = node.keys().get(i);
                if (key == null) {
                    entries.add("**" + format(node.values().get(i), Precedence.BIT_OR, item.reserve(2)));
                } else {
                    Line entry = new Line(item).expr(key, Precedence.IF_EXP).text(": ");
                    entries.add(entry.expr(node.values().get(i), Precedence.LAMBDA).build());
                }
            }
            body = String.join(",\n", entries);
        } else {
            List<String> keys = new ArrayList<>();
            int width = 0;
            for (int i : order) {
                String key = format(node.keys().get(i), Precedence.IF_EXP, scope);
                keys.add(key);
                width = Math.max(width, LayoutContext.lastLine(key).length());
            }
            LayoutContext valueCtx = scope.reserve(width + 2);
            List<Alignment.Pair> pairs = new ArrayList<>();
            for (int n = 0; n < order.size(); n++) {
                LayoutContext item = separated(valueCtx, n, order.size());
                String value = format(node.values().get(order.get(n)), Precedence.LAMBDA, item);
                pairs.add(new Alignment.Pair(keys.get(n), value));
            }
            body = Alignment.align(pairs, ": ", ",\n", "");
        }
        return "{\n" + ctx.indentLines(body) + "\n}";
    }

    @Override
    public String visitListComp(Expr.ListComp node, LayoutContext ctx) {
        return comprehension("[", c -> format(node.element(), Precedence.IF_EXP, c), node.generators(), "]", ctx);
    }

    @Override
    public String visitSetComp(Expr.SetComp node, LayoutContext ctx) {
        return comprehension("{", c -> format(node.element(), Precedence.IF_EXP, c), node.generators(), "}", ctx);
    }

    @Override
    public String visitGeneratorExp(Expr.GeneratorExp node, LayoutContext ctx) {
        return comprehension("(", c -> format(node.element(), Precedence.IF_EXP, c), node.generators(), ")", ctx);
    }

    @Override
    public String visitDictComp(Expr.DictComp node, LayoutContext ctx) {
        Function<LayoutContext, String> entry = c -> new Line(c)
                .expr(node.key(), Precedence.IF_EXP)
                .text(": ")
                .expr(node.value(), Precedence.IF_EXP)
                .build();
        return comprehension("{", entry, node.generators(), "}", ctx);
    }

    @Override
    public String visitYield(Expr.Yield node, LayoutContext ctx) {
        if (node.value() == null) {
            return "yield";
        }
        return new Line(ctx).text("yield ").bare(node.value(), Precedence.LAMBDA).build();
    }

    @Override
    public String visitYieldFrom(Expr.YieldFrom node, LayoutContext ctx) {
        return new Line(ctx).text("yield from ").expr(node.value(), Precedence.LAMBDA).build();
    }

    @Override
    public String visitAwait(Expr.Await node, LayoutContext ctx) {
        return new Line(ctx).text("await ").expr(node.value(), Precedence.ATOM).build();
    }

    // -- parts ----------------------------------------------------------------------------

    @Override
    public String visitModule(Module node, LayoutContext ctx) {
        return formatModule(node, ctx);
    }

    /**
     * Tight {@code key=value} form; block layouts align keywords themselves.
     */
    @Override
    public String visitKeyword(Keyword node, LayoutContext ctx) {
        if (node.isSplat()) {
            return "**" + format(node.value(), Precedence.BIT_OR, ctx.advance(2));
        }
        return node.arg() + "=" + format(node.value(), Precedence.LAMBDA, ctx.advance(node.arg().length() + 1));
    }

    @Override
    public String visitArguments(Arguments node, LayoutContext ctx) {
        return signatures.format(node, ctx, 0);
    }

    @Override
    public String visitArg(Arg node, LayoutContext ctx) {
        if (node.annotation() == null) {
            return node.name();
        }
        return new Line(ctx).text(node.name() + ": ").expr(node.annotation(), Precedence.LAMBDA).build();
    }

    @Override
    public String visitAlias(Alias node, LayoutContext ctx) {
        return node.asname() == null ? node.name() : node.name() + " as " + node.asname();
    }

    @Override
    public String visitComprehension(Comprehension node, LayoutContext ctx) {
        Line line = new Line(ctx);
        List<String> parts = clauses(node, ctx);
        for (int i = 0; i < parts.size(); i++) {
            line.text(i == 0 ? parts.get(i) : " " + parts.get(i));
        }
        return line.build();
    }

    @Override
    public String visitExceptHandler(ExceptHandler node, LayoutContext ctx) {
        String comment = inlineComment(node.position().line(), ctx);
        Line header = new Line(ctx.narrow(1)).text("except");
        if (node.type() != null) {
            header.text(" ").expr(node.type(), Precedence.LAMBDA);
        }
        if (node.name() != null) {
            header.text(" as " + node.name());
        }
        return header.text(":").build() + comment + "\n" + block(node.body(), ctx);
    }

    @Override
    public String visitWithItem(WithItem node, LayoutContext ctx) {
        Line line = new Line(ctx).expr(node.context(), Precedence.LAMBDA);
        if (node.optionalVars() != null) {
            line.text(" as ").expr(node.optionalVars(), Precedence.ATOM);
        }
        return line.build();
    }

    // -- statements -----------------------------------------------------------------------

    @Override
    public String visitExprStatement(Stmt.ExprStatement node, LayoutContext ctx) {
        return format(node.value(), ctx.withSuppressTupleParens(true));
    }

    @Override
    public String visitAssign(Stmt.Assign node, LayoutContext ctx) {
        Line line = new Line(ctx);
        for (Expr target : node.targets()) {
            line.bare(target, Precedence.LAMBDA).text(" = ");
        }
        return line.bare(node.value(), Precedence.YIELD).build();
    }

    @Override
    public String visitAugAssign(Stmt.AugAssign node, LayoutContext ctx) {
        return new Line(ctx)
                .expr(node.target(), Precedence.ATOM)
                .text(" " + node.op().symbol() + "= ")
                .bare(node.value(), Precedence.YIELD)
                .build();
    }

    @Override
    public String visitAnnAssign(Stmt.AnnAssign node, LayoutContext ctx) {
        Line line = new Line(ctx)
                .expr(node.target(), Precedence.ATOM)
                .text(": ")
                .expr(node.annotation(), Precedence.LAMBDA);
        if (node.value() != null) {
            line.text(" = ").bare(node.value(), Precedence.YIELD);
        }
        return line.build();
    }

    @Override
    public String visitFunctionDef(Stmt.FunctionDef node, LayoutContext ctx) {
        StringBuilder out = new StringBuilder(decorators(node.decorators(), ctx));
        String prefix = (node.async() ? "async def " : "def ") + node.name() + "(";
        String suffix = ")";
        if (node.returns() != null) {
            suffix += " -> " + format(node.returns(), Precedence.LAMBDA, ctx.withInline(true));
        }
        suffix += ":";
        String parameters = signatures.format(node.args(), ctx.reserve(prefix.length()), suffix.length());
        out.append(prefix).append(parameters).append(suffix);
        return out.append('\n').append(block(node.body(), ctx)).toString();
    }

    @Override
    public String visitClassDef(Stmt.ClassDef node, LayoutContext ctx) {
        StringBuilder out = new StringBuilder(decorators(node.decorators(), ctx));
        String head = "class " + node.name();
        if (node.bases().isEmpty() && node.keywords().isEmpty()) {
            out.append(head);
        } else {
            out.append(formatArgumentList(head, node.bases(), node.keywords(), ctx.narrow(1)));
        }
        return out.append(":\n").append(block(node.body(), ctx)).toString();
    }

    private String decorators(List<Expr> decorators, LayoutContext ctx) {
        StringBuilder out = new StringBuilder();
        for (Expr decorator : decorators) {
            out.append('@').append(format(decorator, Precedence.LAMBDA, ctx.reserve(1))).append('\n');
        }
        return out.toString();
    }

    @Override
    public String visitIf(Stmt.If node, LayoutContext ctx) {
        StringBuilder out = new StringBuilder(header("if ", node.test(), ctx));
        out.append('\n').append(block(node.body(), ctx));
        List<Stmt> orelse = node.orelse();
        if (orelse.size() == 1 && orelse.get(0) instanceof Stmt.If) {
            Stmt.If elif = (Stmt.If) orelse.get(0);
            String comment = inlineComment(elif.line(), ctx);
            String rendered = "el" + visitIf(elif, ctx);
            int newline = rendered.indexOf('\n');
            out.append('\n').append(rendered, 0, newline).append(comment).append(rendered.substring(newline));
        } else if (!orelse.isEmpty()) {
            out.append("\nelse:\n").append(block(orelse, ctx));
        }
        return out.toString();
    }

    private String header(String keyword, Expr test, LayoutContext ctx) {
        return new Line(ctx.narrow(1)).text(keyword).expr(test, Precedence.LAMBDA).text(":").build();
    }

    @Override
    public String visitFor(Stmt.For node, LayoutContext ctx) {
        String header = new Line(ctx.narrow(1))
                .text(node.async() ? "async for " : "for ")
                .bare(node.target(), Precedence.BIT_OR)
                .text(" in ")
                .bare(node.iter(), Precedence.LAMBDA)
                .text(":")
                .build();
        StringBuilder out = new StringBuilder(header).append('\n').append(block(node.body(), ctx));
        if (!node.orelse().isEmpty()) {
            out.append("\nelse:\n").append(block(node.orelse(), ctx));
        }
        return out.toString();
    }

    @Override
    public String visitWhile(Stmt.While node, LayoutContext ctx) {
        StringBuilder out = new StringBuilder(header("while ", node.test(), ctx));
        out.append('\n').append(block(node.body(), ctx));
        if (!node.orelse().isEmpty()) {
            out.append("\nelse:\n").append(block(node.orelse(), ctx));
        }
        return out.toString();
    }

    @Override
    public String visitTry(Stmt.Try node, LayoutContext ctx) {
        StringBuilder out = new StringBuilder("try:\n").append(block(node.body(), ctx));
        for (ExceptHandler handler : node.handlers()) {
            out.append('\n').append(format(handler, ctx));
        }
        if (!node.orelse().isEmpty()) {
            out.append("\nelse:\n").append(block(node.orelse(), ctx));
        }
        if (!node.finalbody().isEmpty()) {
            out.append("\nfinally:\n").append(block(node.finalbody(), ctx));
        }
        return out.toString();
    }

    @Override
    public String visitWith(Stmt.With node, LayoutContext ctx) {
        Line header = new Line(ctx.narrow(1)).text(node.async() ? "async with " : "with ");
        for (int i = 0; i < node.items().size(); i++) {
            if (i > 0) {
                header.text(", ");
            }
            header.text(format(node.items().get(i), header.context()));
        }
        return header.text(":").build() + "\n" + block(node.body(), ctx);
    }

    @Override
    public String visitImport(Stmt.Import node, LayoutContext ctx) {
        return "import " + sortedNames(node.names(), ctx);
    }

    @Override
    public String visitImportFrom(Stmt.ImportFrom node, LayoutContext ctx) {
        String prefix = "from " + ".".repeat(node.level()) + (node.module() == null ? "" : node.module()) + " import ";
        List<String> names = node.names().stream()
                .map(alias -> format(alias, ctx))
                .sorted()
                .collect(Collectors.toList());
        String compact = prefix + String.join(", ", names);
        if (ctx.fits(compact) || names.contains("*")) {
            return compact;
        }
        return prefix + "(\n" + ctx.indentLines(String.join(",\n", names)) + "\n)";
    }

    private String sortedNames(List<Alias> names, LayoutContext ctx) {
        return names.stream().map(alias -> format(alias, ctx)).sorted().collect(Collectors.joining(", "));
    }

    @Override
    public String visitReturn(Stmt.Return node, LayoutContext ctx) {
        if (node.value() == null) {
            return "return";
        }
        return new Line(ctx).text("return ").bare(node.value(), Precedence.LAMBDA).build();
    }

    @Override
    public String visitRaise(Stmt.Raise node, LayoutContext ctx) {
        if (node.exception() == null) {
            return "raise";
        }
        Line line = new Line(ctx).text("raise ").expr(node.exception(), Precedence.LAMBDA);
        if (node.cause() != null) {
            line.text(" from ").expr(node.cause(), Precedence.LAMBDA);
        }
        return line.build();
    }

    @Override
    public String visitAssert(Stmt.Assert node, LayoutContext ctx) {
        Line line = new Line(ctx).text("assert ").expr(node.test(), Precedence.LAMBDA);
        if (node.message() != null) {
            line.text(", ").expr(node.message(), Precedence.LAMBDA);
        }
        return line.build();
    }

    @Override
    public String visitDelete(Stmt.Delete node, LayoutContext ctx) {
        Line line = new Line(ctx).text("del ");
        for (int i = 0; i < node.targets().size(); i++) {
            if (i > 0) {
                line.text(", ");
            }
            line.expr(node.targets().get(i), Precedence.BIT_OR);
        }
        return line.build();
    }

    @Override
    public String visitGlobal(Stmt.Global node, LayoutContext ctx) {
        return "global " + String.join(", ", node.names());
    }

    @Override
    public String visitNonlocal(Stmt.Nonlocal node, LayoutContext ctx) {
        return "nonlocal " + String.join(", ", node.names());
    }

    @Override
    public String visitPass(Stmt.Pass node, LayoutContext ctx) {
        return "pass";
    }

    @Override
    public String visitBreak(Stmt.Break node, LayoutContext ctx) {
        return "break";
    }

    @Override
    public String visitContinue(Stmt.Continue node, LayoutContext ctx) {
        return "continue";
    }

    /**
     * Accumulates the pieces of one output line, moving the budget along as text is added.
     */
    private final class Line {
        private final StringBuilder text = new StringBuilder();
        private LayoutContext ctx;

        Line(LayoutContext ctx) {
            this.ctx = ctx;
        }

        Line text(String piece) {
            text.append(piece);
            ctx = ctx.advanceText(piece);
            return this;
        }

        Line expr(Expr expr, int minPrecedence) {
            return text(format(expr, minPrecedence, ctx));
        }

        /**
         * Like {@link #expr} but a tuple in this slot goes without parentheses.
         */
        Line bare(Expr expr, int minPrecedence) {
            return text(format(expr, minPrecedence, ctx.withSuppressTupleParens(true)));
        }

        LayoutContext context() {
            return ctx;
        }

        String build() {
            return text.toString();
        }
    }
}
