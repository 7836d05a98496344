package im.arun.pyfmt.model;

public record Alias(String name, String asname) implements Node {

    public static Alias of(String name) {
        return new Alias(name, null);
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
        return visitor.visitAlias(this, param);
    }
}
