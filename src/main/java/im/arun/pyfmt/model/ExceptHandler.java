package im.arun.pyfmt.model;

import java.util.List;

public record ExceptHandler(Position position, Expr type, String name, List<Stmt> body) implements Node {
    public ExceptHandler {
        body = Lists.copy(body);
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
        return visitor.visitExceptHandler(this, param);
    }
}
