package im.arun.pyfmt.format;

import im.arun.pyfmt.comment.CommentCursor;
import im.arun.pyfmt.config.FormatterConfig;
import im.arun.pyfmt.layout.LayoutContext;
import im.arun.pyfmt.model.Alias;
import im.arun.pyfmt.model.Arg;
import im.arun.pyfmt.model.Arguments;
import im.arun.pyfmt.model.BinaryOperator;
import im.arun.pyfmt.model.BoolOperator;
import im.arun.pyfmt.model.CompareOperator;
import im.arun.pyfmt.model.Comprehension;
import im.arun.pyfmt.model.ExceptHandler;
import im.arun.pyfmt.model.Expr;
import im.arun.pyfmt.model.Keyword;
import im.arun.pyfmt.model.Node;
import im.arun.pyfmt.model.Position;
import im.arun.pyfmt.model.Stmt;
import im.arun.pyfmt.model.UnaryOperator;
import im.arun.pyfmt.model.WithItem;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NodeSerializerTest {

    private final NodeSerializer serializer = new NodeSerializer();

    private static LayoutContext ctx(int maxLineLength) {
        FormatterConfig config = new FormatterConfig();
        config.setMaxLineLength(maxLineLength);
        return LayoutContext.root(config, CommentCursor.empty());
    }

    private String format(Node node, int maxLineLength) {
        return serializer.format(node, ctx(maxLineLength));
    }

    private static Expr.Name name(String id) {
        return new Expr.Name(id);
    }

    private static Expr.NumberLiteral num(String text) {
        return new Expr.NumberLiteral(text);
    }

    private static Expr.StringLiteral str(String value) {
        return new Expr.StringLiteral(value);
    }

    private static Expr.Call call(String func, Expr... args) {
        return new Expr.Call(name(func), Arrays.asList(args), List.of());
    }

    private static Expr.BinOp bin(Expr left, BinaryOperator op, Expr right) {
        return new Expr.BinOp(left, op, right);
    }

    /**
     * Every line, indentation included, within {@code maxLineLength}; the default tab is one character.
     */
    static void assertWithin(String text, int maxLineLength) {
        for (String line : text.split("\n", -1)) {
            assertThat(line.length()).as("length of %s", line).isLessThanOrEqualTo(maxLineLength);
        }
    }

    private static Stmt.Pass pass(int line) {
        return new Stmt.Pass(Position.at(line));
    }

    @Nested
    class Calls {

        @Test
        void compactWhenEverythingFits() {
            assertThat(format(call("f", name("a"), name("b"), name("c")), 80)).isEqualTo("f(a, b, c)");
        }

        @Test
        void hangingLayoutForPositionalArgumentsThatDoNotFit() {
            assertThat(format(call("f", name("a"), name("b"), name("c")), 8)).isEqualTo("f(a,\n\tb,\n\tc)");
        }

        @Test
        void emptyArgumentList() {
            assertThat(format(call("f"), 80)).isEqualTo("f()");
        }

        @Test
        void compactKeywordsKeepSourceOrder() {
            Expr.Call call = new Expr.Call(name("func"), List.of(),
                    List.of(new Keyword("beta", num("2")), new Keyword("a", num("1"))));

            assertThat(format(call, 80)).isEqualTo("func(beta=2, a=1)");
        }

        @Test
        void hangingArgumentLeavesRoomForClosingParenthesis() {
            String text = format(call("f", str("aaaa bbbb"), str("cccc dddd eeee ff")), 20);

            assertThat(text).isEqualTo("f(\"aaaa bbbb\",\n\t(\n\t\t\"cccc dddd eeee \"\n\t\t\"ff\"\n\t))");
            assertWithin(text, 20);
        }

        @Test
        void verticalKeywordsAreSortedAndAligned() {
            Expr.Call call = new Expr.Call(name("func"), List.of(),
                    List.of(new Keyword("beta", num("2")), new Keyword("a", num("1"))));

            assertThat(format(call, 10)).isEqualTo("func(\n\ta    = 1,\n\tbeta = 2,\n)");
        }

        @Test
        void verticalLayoutPutsPositionalArgumentsFirstAndSplatsLast() {
            Expr.Call call = new Expr.Call(name("f"), List.of(name("x"), new Expr.Starred(name("rest"))),
                    List.of(new Keyword(null, name("extra")), new Keyword("k", name("y"))));

            assertThat(format(call, 5)).isEqualTo("f(\n\tx,\n\t*rest,\n\tk = y,\n\t**extra,\n)");
        }

        @Test
        void loneGeneratorArgumentSharesParentheses() {
            Expr.GeneratorExp generator = new Expr.GeneratorExp(name("x"),
                    List.of(new Comprehension(name("x"), name("xs"), List.of(), false)));

            assertThat(format(call("sum", generator), 80)).isEqualTo("sum(x for x in xs)");
        }
    }

    @Nested
    class Collections {

        @Test
        void dictIsSortedByKeyWhenCompact() {
            Expr.DictLiteral dict = new Expr.DictLiteral(List.of(name("b"), name("a")), List.of(num("2"), num("1")));

            assertThat(format(dict, 80)).isEqualTo("{a: 1, b: 2}");
        }

        @Test
        void dictExpandsOneAlignedEntryPerLine() {
            Expr.DictLiteral dict = new Expr.DictLiteral(List.of(name("b"), name("a")), List.of(num("2"), num("1")));

            assertThat(format(dict, 5)).isEqualTo("{\n\ta: 1,\n\tb: 2\n}");
        }

        @Test
        void dictValueLeavesRoomForComma() {
            Expr.DictLiteral dict = new Expr.DictLiteral(
                    List.of(name("a"), name("b")), List.of(str("xxxx yyyy zzzz"), num("2")));

            String text = format(dict, 20);

            assertThat(text).isEqualTo("{\n\ta: (\n\t\t\"xxxx yyyy zzzz\"\n\t),\n\tb: 2\n}");
            assertWithin(text, 20);
        }

        @Test
        void dictAlignsValuesOnColon() {
            Expr.DictLiteral dict = new Expr.DictLiteral(
                    List.of(str("key"), str("k")), List.of(num("1"), num("2")));

            assertThat(format(dict, 10)).isEqualTo("{\n\t\"k\"  : 2,\n\t\"key\": 1\n}");
        }

        @Test
        void dictWithUnpackingKeepsSourceOrder() {
            Expr.DictLiteral dict = new Expr.DictLiteral(
                    Arrays.asList(name("b"), null), List.of(num("1"), name("c")));

            assertThat(format(dict, 80)).isEqualTo("{b: 1, **c}");
        }

        @Test
        void emptyCollections() {
            assertThat(format(new Expr.DictLiteral(List.of(), List.of()), 80)).isEqualTo("{}");
            assertThat(format(new Expr.SetLiteral(List.of()), 80)).isEqualTo("set()");
            assertThat(format(new Expr.ListLiteral(List.of()), 80)).isEqualTo("[]");
            assertThat(format(new Expr.TupleLiteral(List.of()), 80)).isEqualTo("()");
        }

        @Test
        void listExpandsOneElementPerLine() {
            Expr.ListLiteral list = new Expr.ListLiteral(List.of(name("aaaa"), name("bbbb")));

            assertThat(format(list, 5)).isEqualTo("[\n\taaaa,\n\tbbbb\n]");
        }

        @Test
        void singleElementTupleKeepsItsComma() {
            Expr.TupleLiteral tuple = new Expr.TupleLiteral(List.of(name("aaaaaa")));

            assertThat(format(tuple, 80)).isEqualTo("(aaaaaa,)");
            assertThat(format(tuple, 3)).isEqualTo("(\n\taaaaaa,\n)");
        }

        @Test
        void comprehensionExpandsClausesOntoOwnLines() {
            Expr.ListComp comp = new Expr.ListComp(name("x"),
                    List.of(new Comprehension(name("x"), name("items"), List.of(name("x")), false)));

            assertThat(format(comp, 80)).isEqualTo("[x for x in items if x]");
            assertThat(format(comp, 10)).isEqualTo("[\n\tx\n\tfor x in items\n\tif x\n]");
        }

        @Test
        void dictComprehensionWithTupleTarget() {
            Expr.DictComp comp = new Expr.DictComp(name("k"), name("v"), List.of(new Comprehension(
                    new Expr.TupleLiteral(List.of(name("k"), name("v"))),
                    new Expr.Call(new Expr.Attribute(name("d"), "items"), List.of(), List.of()),
                    List.of(), false)));

            assertThat(format(comp, 80)).isEqualTo("{k: v for k, v in d.items()}");
        }
    }

    @Nested
    class Precedence {

        @Test
        void parenthesizesLooserOperand() {
            Expr product = bin(bin(name("a"), BinaryOperator.ADD, name("b")), BinaryOperator.MULT, name("c"));

            assertThat(format(product, 80)).isEqualTo("(a + b) * c");
        }

        @Test
        void leftAssociativeChainNeedsNoParentheses() {
            Expr chain = bin(bin(name("a"), BinaryOperator.SUB, name("b")), BinaryOperator.ADD, name("c"));

            assertThat(format(chain, 80)).isEqualTo("a - b + c");
        }

        @Test
        void rightOperandOfSamePrecedenceIsParenthesized() {
            Expr difference = bin(name("a"), BinaryOperator.SUB, bin(name("b"), BinaryOperator.SUB, name("c")));

            assertThat(format(difference, 80)).isEqualTo("a - (b - c)");
        }

        @Test
        void powerIsRightAssociativeAndBindsTighterThanUnaryMinus() {
            Expr power = bin(name("a"), BinaryOperator.POW, bin(name("b"), BinaryOperator.POW, name("c")));
            Expr negatedBase = bin(new Expr.UnaryOp(UnaryOperator.USUB, num("2")), BinaryOperator.POW, num("2"));
            Expr negatedPower = new Expr.UnaryOp(UnaryOperator.USUB, bin(num("2"), BinaryOperator.POW, num("2")));

            assertThat(format(power, 80)).isEqualTo("a ** b ** c");
            assertThat(format(negatedBase, 80)).isEqualTo("(-2) ** 2");
            assertThat(format(negatedPower, 80)).isEqualTo("-2 ** 2");
        }

        @Test
        void notAppliesToWholeComparisonButNotToBooleanOperator() {
            Expr notEqual = new Expr.UnaryOp(UnaryOperator.NOT, new Expr.Compare(name("a"),
                    List.of(CompareOperator.EQ), List.of(name("b"))));
            Expr notAnd = new Expr.UnaryOp(UnaryOperator.NOT,
                    new Expr.BoolOp(BoolOperator.AND, List.of(name("a"), name("b"))));

            assertThat(format(notEqual, 80)).isEqualTo("not a == b");
            assertThat(format(notAnd, 80)).isEqualTo("not (a and b)");
        }

        @Test
        void yieldInArgumentPositionIsParenthesized() {
            assertThat(format(call("f", new Expr.Yield(name("x"))), 80)).isEqualTo("f((yield x))");
        }

        @Test
        void integerAttributeIsParenthesized() {
            assertThat(format(new Expr.Attribute(num("1"), "real"), 80)).isEqualTo("(1).real");
            assertThat(format(new Expr.Attribute(num("1.5"), "real"), 80)).isEqualTo("1.5.real");
        }

        @Test
        void conditionalExpressionNesting() {
            Expr inner = new Expr.IfExp(name("b"), name("a"), name("e"));
            Expr outer = new Expr.IfExp(name("c"), inner, new Expr.IfExp(name("f"), name("d"), name("g")));

            assertThat(format(outer, 80)).isEqualTo("(a if b else e) if c else d if f else g");
        }

        @Test
        void walrusIsAlwaysParenthesized() {
            assertThat(format(new Expr.NamedExpr(name("x"), num("1")), 80)).isEqualTo("(x := 1)");
        }

        @Test
        void awaitAndYieldFrom() {
            assertThat(format(new Expr.Await(call("g")), 80)).isEqualTo("await g()");
            assertThat(format(new Expr.YieldFrom(call("g")), 80)).isEqualTo("yield from g()");
        }
    }

    @Nested
    class Chains {

        @Test
        void booleanChainBreaksBeforeEachOperator() {
            Expr chain = new Expr.BoolOp(BoolOperator.AND, List.of(name("aaaa"), name("bbbb"), name("cccc")));

            assertThat(format(chain, 80)).isEqualTo("aaaa and bbbb and cccc");
            assertThat(format(chain, 10)).isEqualTo("(\n\taaaa\n\tand bbbb\n\tand cccc\n)");
        }

        @Test
        void arithmeticChainBreaksBeforeEachOperator() {
            Expr chain = bin(bin(name("aaaa"), BinaryOperator.ADD, name("bbbb")), BinaryOperator.SUB, name("cccc"));

            assertThat(format(chain, 10)).isEqualTo("(\n\taaaa\n\t+ bbbb\n\t- cccc\n)");
        }

        @Test
        void lambdaBodyMovesIntoParentheses() {
            Arguments params = Arguments.positional(List.of(Arg.of("x")), List.of());
            Expr.Lambda lambda = new Expr.Lambda(params, call("f", name("x")));

            assertThat(format(lambda, 80)).isEqualTo("lambda x: f(x)");
            assertThat(format(lambda, 10)).isEqualTo("lambda x: (\n\tf(x)\n)");
            assertThat(format(new Expr.Lambda(Arguments.empty(), num("1")), 80)).isEqualTo("lambda: 1");
        }
    }

    @Nested
    class Subscripts {

        @Test
        void tupleIndexGoesWithoutParentheses() {
            Expr subscript = new Expr.Subscript(name("a"), new Expr.TupleLiteral(List.of(num("1"), num("2"))));

            assertThat(format(subscript, 80)).isEqualTo("a[1, 2]");
        }

        @Test
        void slices() {
            assertThat(format(new Expr.Subscript(name("a"), new Expr.Slice(num("1"), num("2"), null)), 80))
                    .isEqualTo("a[1:2]");
            assertThat(format(new Expr.Subscript(name("a"), new Expr.Slice(null, null, num("2"))), 80))
                    .isEqualTo("a[::2]");
        }
    }

    @Nested
    class Statements {

        @Test
        void assignmentTuplesGoWithoutParentheses() {
            Stmt assign = new Stmt.Assign(Position.at(1),
                    List.of(new Expr.TupleLiteral(List.of(name("a"), name("b")))),
                    new Expr.TupleLiteral(List.of(num("1"), num("2"))));

            assertThat(format(assign, 80)).isEqualTo("a, b = 1, 2");
        }

        @Test
        void tupleArgumentKeepsParentheses() {
            assertThat(format(new Stmt.ExprStatement(Position.at(1),
                    call("f", new Expr.TupleLiteral(List.of(num("1"), num("2"))))), 80))
                    .isEqualTo("f((1, 2))");
        }

        @Test
        void simpleStatements() {
            Position at = Position.at(1);

            assertThat(format(new Stmt.AugAssign(at, name("x"), BinaryOperator.ADD, num("1")), 80))
                    .isEqualTo("x += 1");
            assertThat(format(new Stmt.AnnAssign(at, name("x"), name("int"), num("1")), 80))
                    .isEqualTo("x: int = 1");
            assertThat(format(new Stmt.Return(at, new Expr.TupleLiteral(List.of(name("a"), name("b")))), 80))
                    .isEqualTo("return a, b");
            assertThat(format(new Stmt.Raise(at, call("ValueError"), name("e")), 80))
                    .isEqualTo("raise ValueError() from e");
            assertThat(format(new Stmt.Assert(at, name("x"), str("msg")), 80))
                    .isEqualTo("assert x, \"msg\"");
            assertThat(format(new Stmt.Delete(at, List.of(name("a"),
                    new Expr.Subscript(name("b"), num("0")))), 80)).isEqualTo("del a, b[0]");
            assertThat(format(new Stmt.Global(at, List.of("a", "b")), 80)).isEqualTo("global a, b");
            assertThat(format(new Stmt.Return(at, null), 80)).isEqualTo("return");
        }

        @Test
        void elseHoldingOnlyAnIfBecomesElif() {
            Stmt chain = new Stmt.If(Position.at(1), name("a"), List.of(pass(2)),
                    List.of(new Stmt.If(Position.at(3), name("b"), List.of(pass(4)), List.of(pass(6)))));

            assertThat(format(chain, 80)).isEqualTo("if a:\n\tpass\nelif b:\n\tpass\nelse:\n\tpass");
        }

        @Test
        void forLoopWithTupleTargetAndElse() {
            Stmt loop = new Stmt.For(Position.at(1),
                    new Expr.TupleLiteral(List.of(name("k"), name("v"))),
                    new Expr.Call(new Expr.Attribute(name("d"), "items"), List.of(), List.of()),
                    List.of(pass(2)), List.of(new Stmt.Break(Position.at(4))), false);

            assertThat(format(loop, 80)).isEqualTo("for k, v in d.items():\n\tpass\nelse:\n\tbreak");
        }

        @Test
        void tryWithAllClauses() {
            Stmt attempt = new Stmt.Try(Position.at(1), List.of(pass(2)),
                    List.of(new ExceptHandler(Position.at(3), name("ValueError"), "e", List.of(pass(4)))),
                    List.of(pass(6)), List.of(pass(8)));

            assertThat(format(attempt, 80))
                    .isEqualTo("try:\n\tpass\nexcept ValueError as e:\n\tpass\nelse:\n\tpass\nfinally:\n\tpass");
        }

        @Test
        void withStatement() {
            Stmt with = new Stmt.With(Position.at(1),
                    List.of(new WithItem(call("open", str("f")), name("fh"))), List.of(pass(2)), true);

            assertThat(format(with, 80)).isEqualTo("async with open(\"f\") as fh:\n\tpass");
        }

        @Test
        void nestedBlocksIndentRelativeToParent() {
            Stmt inner = new Stmt.While(Position.at(2), name("b"), List.of(pass(3)), List.of());
            Stmt outer = new Stmt.If(Position.at(1), name("a"), List.of(inner), List.of());

            assertThat(format(outer, 80)).isEqualTo("if a:\n\twhile b:\n\t\tpass");
        }

        @Test
        void decoratedAsyncFunction() {
            Arguments params = new Arguments(List.of(), List.of(Arg.of("a"), Arg.of("b")), List.of(num("1")),
                    null, List.of(), List.of(), null);
            Stmt def = new Stmt.FunctionDef(Position.at(2), "f", params,
                    List.of(new Stmt.Return(Position.at(3), new Expr.TupleLiteral(List.of(name("a"), name("b"))))),
                    List.of(name("staticmethod")), name("int"), true);

            assertThat(format(def, 80)).isEqualTo("@staticmethod\nasync def f(a, b=1) -> int:\n\treturn a, b");
        }

        @Test
        void classHeaderSharesCallLayout() {
            Stmt cls = new Stmt.ClassDef(Position.at(1), "A", List.of(name("Base")),
                    List.of(new Keyword("metaclass", name("Meta"))), List.of(pass(2)), List.of());
            Stmt bare = new Stmt.ClassDef(Position.at(1), "B", List.of(), List.of(), List.of(pass(2)), List.of());

            assertThat(format(cls, 80)).isEqualTo("class A(Base, metaclass=Meta):\n\tpass");
            assertThat(format(bare, 80)).isEqualTo("class B:\n\tpass");
        }

        @Test
        void emptyBodyBecomesPass() {
            Stmt def = new Stmt.FunctionDef(Position.at(1), "f", null, List.of(), List.of(), null, false);

            assertThat(format(def, 80)).isEqualTo("def f():\n\tpass");
        }

        @Test
        void importsSortTheirNames() {
            Stmt imports = new Stmt.Import(Position.at(1), List.of(Alias.of("sys"), new Alias("numpy", "np")));
            Stmt relative = new Stmt.ImportFrom(Position.at(1), null, List.of(Alias.of("x")), 2);

            assertThat(format(imports, 80)).isEqualTo("import numpy as np, sys");
            assertThat(format(relative, 80)).isEqualTo("from .. import x");
        }

        @Test
        void longFromImportFallsBackToParentheses() {
            Stmt from = new Stmt.ImportFrom(Position.at(1), "os.path",
                    List.of(Alias.of("join"), Alias.of("exists")), 0);

            assertThat(format(from, 20)).isEqualTo("from os.path import (\n\texists,\n\tjoin\n)");
        }
    }
}
