package im.arun.pyfmt.format;

import im.arun.pyfmt.layout.LayoutContext;
import im.arun.pyfmt.model.Arg;
import im.arun.pyfmt.model.Arguments;
import im.arun.pyfmt.model.Expr;
import im.arun.pyfmt.model.Precedence;
import im.arun.pyfmt.util.Alignment;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameter lists of {@code def} headers and lambdas.
 *
 * <p>Parameters follow PEP 8 spacing: {@code a=1} without an annotation,
 * {@code a: int = 1} with one. A list that does not fit goes one parameter per indented
 * line, with defaulted keyword-only parameters aligned on {@code =}.
 */
public class SignatureFormatter {

    private final NodeSerializer serializer;

    public SignatureFormatter(NodeSerializer serializer) {
        this.serializer = serializer;
    }

    /**
     * Text between the parentheses of a {@code def}. {@code ctx} is positioned just after
     * the opening parenthesis and {@code suffixLength} characters must stay free after the
     * closing one.
     */
    public String format(Arguments args, LayoutContext ctx, int suffixLength) {
        if (args.isEmpty()) {
            return "";
        }
        List<Parameter> parameters = parameters(args);
        String compact = compact(parameters, ctx.withInline(true));
        if (ctx.isInline() || ctx.narrow(suffixLength).fits(compact)) {
            return compact;
        }

        LayoutContext scope = ctx.enterScope();
        List<String> lines = new ArrayList<>();
        List<Parameter> run = new ArrayList<>();
        for (int i = 0; i < parameters.size(); i++) {
            Parameter parameter = parameters.get(i);
            if (parameter.keywordOnly() && parameter.defaultValue() != null) {
                run.add(parameter);
                continue;
            }
            flushAligned(run, scope, lines, false);
            lines.add(render(parameter, NodeSerializer.separated(scope, i, parameters.size())));
        }
        flushAligned(run, scope, lines, true);
        return "\n" + ctx.indentLines(String.join(",\n", lines)) + "\n";
    }

    /**
     * Lambda parameters never break.
     */
    public String formatLambda(Arguments args, LayoutContext ctx) {
        if (args.isEmpty()) {
            return "";
        }
        return compact(parameters(args), ctx.withInline(true));
    }

    private String compact(List<Parameter> parameters, LayoutContext ctx) {
        StringBuilder out = new StringBuilder();
        for (Parameter parameter : parameters) {
            if (out.length() > 0) {
                out.append(", ");
            }
            out.append(render(parameter, ctx.advanceText(out.toString())));
        }
        return out.toString();
    }

    /**
     * Adds the pending run of defaulted keyword-only parameters, aligned on {@code =}.
     * Unless the run ends the list, its last default is followed by a comma too.
     */
    private void flushAligned(List<Parameter> run, LayoutContext scope, List<String> lines, boolean endsList) {
        if (run.isEmpty()) {
            return;
        }
        List<String> heads = new ArrayList<>();
        int width = 0;
        for (Parameter parameter : run) {
            String head = head(parameter, scope);
            heads.add(head);
            width = Math.max(width, LayoutContext.lastLine(head).length());
        }
        LayoutContext valueCtx = scope.reserve(width + 3);
        List<Alignment.Pair> pairs = new ArrayList<>();
        int count = endsList ? run.size() : run.size() + 1;
        for (int i = 0; i < run.size(); i++) {
            LayoutContext item = NodeSerializer.separated(valueCtx, i, count);
            String value = serializer.format(run.get(i).defaultValue(), Precedence.LAMBDA, item);
            pairs.add(new Alignment.Pair(heads.get(i), value));
        }
        lines.add(Alignment.align(pairs, " = ", ",\n", ""));
        run.clear();
    }

    private String render(Parameter parameter, LayoutContext ctx) {
        if (parameter.arg() == null) {
            return parameter.prefix();
        }
        String head = head(parameter, ctx);
        if (parameter.defaultValue() == null) {
            return head;
        }
        String separator = parameter.arg().annotation() == null ? "=" : " = ";
        LayoutContext valueCtx = ctx.advanceText(head + separator);
        return head + separator + serializer.format(parameter.defaultValue(), Precedence.LAMBDA, valueCtx);
    }

    private String head(Parameter parameter, LayoutContext ctx) {
        String name = parameter.prefix() + parameter.arg().name();
        Expr annotation = parameter.arg().annotation();
        if (annotation == null) {
            return name;
        }
        return name + ": " + serializer.format(annotation, Precedence.LAMBDA, ctx.advance(name.length() + 2));
    }

    private static List<Parameter> parameters(Arguments args) {
        List<Parameter> parameters = new ArrayList<>();
        List<Arg> positional = new ArrayList<>(args.posonlyargs());
        positional.addAll(args.args());
        int firstDefault = positional.size() - args.defaults().size();
        for (int i = 0; i < positional.size(); i++) {
            Expr defaultValue = i >= firstDefault ? args.defaults().get(i - firstDefault) : null;
            parameters.add(new Parameter("", positional.get(i), defaultValue, false));
            if (i == args.posonlyargs().size() - 1) {
                parameters.add(Parameter.marker("/"));
            }
        }
        if (args.vararg() != null) {
            parameters.add(new Parameter("*", args.vararg(), null, false));
        } else if (!args.kwonlyargs().isEmpty()) {
            parameters.add(Parameter.marker("*"));
        }
        for (int i = 0; i < args.kwonlyargs().size(); i++) {
            parameters.add(new Parameter("", args.kwonlyargs().get(i), args.kwDefaults().get(i), true));
        }
        if (args.kwarg() != null) {
            parameters.add(new Parameter("**", args.kwarg(), null, false));
        }
        return parameters;
    }

    /**
     * One slot of a parameter list; a bare {@code /} or {@code *} has no {@link Arg}.
     */
    private record Parameter(String prefix, Arg arg, Expr defaultValue, boolean keywordOnly) {
        static Parameter marker(String text) {
            return new Parameter(text, null, null, false);
        }
    }
}
