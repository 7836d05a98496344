package im.arun.pyfmt.model;

import java.util.List;

/**
 * One {@code for target in iter if ...} clause of a comprehension.
 */
public record Comprehension(Expr target, Expr iter, List<Expr> ifs, boolean async) implements Node {
    public Comprehension {
        ifs = Lists.copy(ifs);
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
        return visitor.visitComprehension(this, param);
    }
}
