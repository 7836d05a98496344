package im.arun.pyfmt.model;

import java.util.List;

/**
 * Parameter list of a function or lambda, in the shape the Python parser produces it:
 * {@code defaults} align with the tail of {@code posonlyargs + args}, and {@code kwDefaults}
 * has one (possibly null) entry per keyword-only parameter.
 */
public record Arguments(
        List<Arg> posonlyargs,
        List<Arg> args,
        List<Expr> defaults,
        Arg vararg,
        List<Arg> kwonlyargs,
        List<Expr> kwDefaults,
        Arg kwarg
) implements Node {

    public Arguments {
        posonlyargs = Lists.copy(posonlyargs);
        args = Lists.copy(args);
        defaults = Lists.copy(defaults);
        kwonlyargs = Lists.copy(kwonlyargs);
        kwDefaults = Lists.copy(kwDefaults);
        if (kwDefaults.size() != kwonlyargs.size()) {
            throw new IllegalArgumentException("kwDefaults must have one entry per keyword-only parameter");
        }
        if (defaults.size() > posonlyargs.size() + args.size()) {
            throw new IllegalArgumentException("more defaults than positional parameters");
        }
    }

    public static Arguments empty() {
        return new Arguments(List.of(), List.of(), List.of(), null, List.of(), List.of(), null);
    }

    public static Arguments positional(List<Arg> args, List<Expr> defaults) {
        return new Arguments(List.of(), args, defaults, null, List.of(), List.of(), null);
    }

    public boolean isEmpty() {
        return posonlyargs.isEmpty() && args.isEmpty() && vararg == null && kwonlyargs.isEmpty() && kwarg == null;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
        return visitor.visitArguments(this, param);
    }
}
