package im.arun.pyfmt.model;

import java.util.List;

/**
 * Statement variants. Every statement knows where it started in the source, which is
 * what comment reattachment keys on.
 */
public sealed interface Stmt extends Node {

    Position position();

    default int line() {
        return position().line();
    }

    record ExprStatement(Position position, Expr value) implements Stmt {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitExprStatement(this, param);
        }
    }

    record Assign(Position position, List<Expr> targets, Expr value) implements Stmt {
        public Assign {
            targets = Lists.copy(targets);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitAssign(this, param);
        }
    }

    record AugAssign(Position position, Expr target, BinaryOperator op, Expr value) implements Stmt {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitAugAssign(this, param);
        }
    }

    record AnnAssign(Position position, Expr target, Expr annotation, Expr value) implements Stmt {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitAnnAssign(this, param);
        }
    }

    record FunctionDef(
            Position position,
            String name,
            Arguments args,
            List<Stmt> body,
            List<Expr> decorators,
            Expr returns,
            boolean async
    ) implements Stmt {
        public FunctionDef {
            body = Lists.copy(body);
            decorators = Lists.copy(decorators);
            args = args != null ? args : Arguments.empty();
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitFunctionDef(this, param);
        }
    }

    record ClassDef(
            Position position,
            String name,
            List<Expr> bases,
            List<Keyword> keywords,
            List<Stmt> body,
            List<Expr> decorators
    ) implements Stmt {
        public ClassDef {
            bases = Lists.copy(bases);
            keywords = Lists.copy(keywords);
            body = Lists.copy(body);
            decorators = Lists.copy(decorators);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitClassDef(this, param);
        }
    }

    record If(Position position, Expr test, List<Stmt> body, List<Stmt> orelse) implements Stmt {
        public If {
            body = Lists.copy(body);
            orelse = Lists.copy(orelse);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitIf(this, param);
        }
    }

    record For(Position position, Expr target, Expr iter, List<Stmt> body, List<Stmt> orelse, boolean async)
            implements Stmt {
        public For {
            body = Lists.copy(body);
            orelse = Lists.copy(orelse);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitFor(this, param);
        }
    }

    record While(Position position, Expr test, List<Stmt> body, List<Stmt> orelse) implements Stmt {
        public While {
            body = Lists.copy(body);
            orelse = Lists.copy(orelse);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitWhile(this, param);
        }
    }

    record Try(
            Position position,
            List<Stmt> body,
            List<ExceptHandler> handlers,
            List<Stmt> orelse,
            List<Stmt> finalbody
    ) implements Stmt {
        public Try {
            body = Lists.copy(body);
            handlers = Lists.copy(handlers);
            orelse = Lists.copy(orelse);
            finalbody = Lists.copy(finalbody);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitTry(this, param);
        }
    }

    record With(Position position, List<WithItem> items, List<Stmt> body, boolean async) implements Stmt {
        public With {
            items = Lists.copy(items);
            body = Lists.copy(body);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitWith(this, param);
        }
    }

    record Import(Position position, List<Alias> names) implements Stmt {
        public Import {
            names = Lists.copy(names);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitImport(this, param);
        }
    }

    /**
     * {@code from <dots><module> import names}; {@code module} is null for {@code from . import x}.
     */
    record ImportFrom(Position position, String module, List<Alias> names, int level) implements Stmt {
        public ImportFrom {
            names = Lists.copy(names);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitImportFrom(this, param);
        }
    }

    record Return(Position position, Expr value) implements Stmt {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitReturn(this, param);
        }
    }

    record Raise(Position position, Expr exception, Expr cause) implements Stmt {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitRaise(this, param);
        }
    }

    record Assert(Position position, Expr test, Expr message) implements Stmt {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitAssert(this, param);
        }
    }

    record Delete(Position position, List<Expr> targets) implements Stmt {
        public Delete {
            targets = Lists.copy(targets);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitDelete(this, param);
        }
    }

    record Global(Position position, List<String> names) implements Stmt {
        public Global {
            names = Lists.copy(names);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitGlobal(this, param);
        }
    }

    record Nonlocal(Position position, List<String> names) implements Stmt {
        public Nonlocal {
            names = Lists.copy(names);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitNonlocal(this, param);
        }
    }

    record Pass(Position position) implements Stmt {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitPass(this, param);
        }
    }

    record Break(Position position) implements Stmt {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitBreak(this, param);
        }
    }

    record Continue(Position position) implements Stmt {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitContinue(this, param);
        }
    }
}
