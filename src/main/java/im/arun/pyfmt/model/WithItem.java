package im.arun.pyfmt.model;

public record WithItem(Expr context, Expr optionalVars) implements Node {

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
        return visitor.visitWithItem(this, param);
    }
}
