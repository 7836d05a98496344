package im.arun.pyfmt.model;

/**
 * A keyword argument of a call or class header. A null {@code arg} is a {@code **mapping} splat.
 */
public record Keyword(String arg, Expr value) implements Node {

    public boolean isSplat() {
        return arg == null;
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
        return visitor.visitKeyword(this, param);
    }
}
