package im.arun.pyfmt.model;

/**
 * One element of a parsed Python program tree.
 *
 * <p>The family is closed: every variant is a record listed in {@link Expr}, {@link Stmt}
 * or the part types below, so a {@link NodeVisitor} that misses a variant does not compile.
 */
public sealed interface Node
        permits Expr, Stmt, Module, Keyword, Arguments, Arg, Alias, Comprehension, ExceptHandler, WithItem {

    <R, P> R accept(NodeVisitor<R, P> visitor, P param);

    /**
     * Short kind name used in diagnostics.
     */
    default String kind() {
        return getClass().getSimpleName();
    }
}
