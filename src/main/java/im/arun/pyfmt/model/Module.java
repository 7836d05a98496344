package im.arun.pyfmt.model;

import java.util.List;

public record Module(List<Stmt> body) implements Node {
    public Module {
        body = Lists.copy(body);
    }

    @Override
    public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
        return visitor.visitModule(this, param);
    }
}
