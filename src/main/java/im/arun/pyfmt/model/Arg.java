package im.arun.pyfmt.model;

public record Arg(String name, Expr annotation) implements Node {

    public static Arg of(String name) {
        return new Arg(name, null);
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
        return visitor.visitArg(this, param);
    }
}
