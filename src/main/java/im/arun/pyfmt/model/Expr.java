package im.arun.pyfmt.model;

import java.util.List;

/**
 * Expression variants. Each carries the precedence it binds with, which decides
 * where the serializer must add parentheses the parser dropped.
 */
public sealed interface Expr extends Node {

    default int precedence() {
        return Precedence.ATOM;
    }

    record StringLiteral(String value) implements Expr {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitStringLiteral(this, param);
        }
    }

    /**
     * Numeric literal kept as source text ({@code 10}, {@code 0x1F}, {@code 1.5e3}).
     */
    record NumberLiteral(String text) implements Expr {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitNumberLiteral(this, param);
        }
    }

    /**
     * {@code True}, {@code False}, {@code None} or {@code ...}.
     */
    record NameConstant(String text) implements Expr {
        public static final NameConstant TRUE = new NameConstant("True");
        public static final NameConstant FALSE = new NameConstant("False");
        public static final NameConstant NONE = new NameConstant("None");
        public static final NameConstant ELLIPSIS = new NameConstant("...");

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitNameConstant(this, param);
        }
    }

    record Name(String id) implements Expr {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitName(this, param);
        }
    }

    record Attribute(Expr value, String attr) implements Expr {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitAttribute(this, param);
        }
    }

    record Subscript(Expr value, Expr slice) implements Expr {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitSubscript(this, param);
        }
    }

    /**
     * {@code lower:upper:step}; every bound is optional.
     */
    record Slice(Expr lower, Expr upper, Expr step) implements Expr {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitSlice(this, param);
        }
    }

    record Call(Expr func, List<Expr> args, List<Keyword> keywords) implements Expr {
        public Call {
            args = Lists.copy(args);
            keywords = Lists.copy(keywords);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitCall(this, param);
        }
    }

    record Starred(Expr value) implements Expr {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitStarred(this, param);
        }
    }

    record UnaryOp(UnaryOperator op, Expr operand) implements Expr {
        @Override
        public int precedence() {
            return op.precedence();
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitUnaryOp(this, param);
        }
    }

    record BinOp(Expr left, BinaryOperator op, Expr right) implements Expr {
        @Override
        public int precedence() {
            return op.precedence();
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitBinOp(this, param);
        }
    }

    record BoolOp(BoolOperator op, List<Expr> values) implements Expr {
        public BoolOp {
            values = Lists.copy(values);
        }

        @Override
        public int precedence() {
            return op.precedence();
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitBoolOp(this, param);
        }
    }

    record Compare(Expr left, List<CompareOperator> ops, List<Expr> comparators) implements Expr {
        public Compare {
            ops = Lists.copy(ops);
            comparators = Lists.copy(comparators);
            if (ops.size() != comparators.size()) {
                throw new IllegalArgumentException("comparison needs one operator per comparator");
            }
        }

        @Override
        public int precedence() {
            return Precedence.COMPARE;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitCompare(this, param);
        }
    }

    record IfExp(Expr test, Expr body, Expr orelse) implements Expr {
        @Override
        public int precedence() {
            return Precedence.IF_EXP;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitIfExp(this, param);
        }
    }

    record Lambda(Arguments args, Expr body) implements Expr {
        @Override
        public int precedence() {
            return Precedence.LAMBDA;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitLambda(this, param);
        }
    }

    /**
     * Assignment expression; always rendered parenthesized, so it binds as an atom.
     */
    record NamedExpr(Expr target, Expr value) implements Expr {
        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitNamedExpr(this, param);
        }
    }

    record ListLiteral(List<Expr> elements) implements Expr {
        public ListLiteral {
            elements = Lists.copy(elements);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitListLiteral(this, param);
        }
    }

    record TupleLiteral(List<Expr> elements) implements Expr {
        public TupleLiteral {
            elements = Lists.copy(elements);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitTupleLiteral(this, param);
        }
    }

    record SetLiteral(List<Expr> elements) implements Expr {
        public SetLiteral {
            elements = Lists.copy(elements);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitSetLiteral(this, param);
        }
    }

    /**
     * Dict display. A null key marks a {@code **mapping} entry.
     */
    record DictLiteral(List<Expr> keys, List<Expr> values) implements Expr {
        public DictLiteral {
            keys = Lists.copy(keys);
            values = Lists.copy(values);
            if (keys.size() != values.size()) {
                throw new IllegalArgumentException("dict needs one value per key");
            }
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitDictLiteral(this, param);
        }
    }

    record ListComp(Expr element, List<Comprehension> generators) implements Expr {
        public ListComp {
            generators = Lists.copy(generators);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitListComp(this, param);
        }
    }

    record SetComp(Expr element, List<Comprehension> generators) implements Expr {
        public SetComp {
            generators = Lists.copy(generators);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitSetComp(this, param);
        }
    }

    record GeneratorExp(Expr element, List<Comprehension> generators) implements Expr {
        public GeneratorExp {
            generators = Lists.copy(generators);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitGeneratorExp(this, param);
        }
    }

    record DictComp(Expr key, Expr value, List<Comprehension> generators) implements Expr {
        public DictComp {
            generators = Lists.copy(generators);
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitDictComp(this, param);
        }
    }

    record Yield(Expr value) implements Expr {
        @Override
        public int precedence() {
            return Precedence.YIELD;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitYield(this, param);
        }
    }

    record YieldFrom(Expr value) implements Expr {
        @Override
        public int precedence() {
            return Precedence.YIELD;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitYieldFrom(this, param);
        }
    }

    record Await(Expr value) implements Expr {
        @Override
        public int precedence() {
            return Precedence.AWAIT;
        }

        @Override
        public <R, P> R accept(NodeVisitor<R, P> visitor, P param) {
            return visitor.visitAwait(this, param);
        }
    }
}
