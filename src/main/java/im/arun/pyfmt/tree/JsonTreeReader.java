package im.arun.pyfmt.tree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import im.arun.pyfmt.exception.TreeParseException;
import im.arun.pyfmt.exception.UnsupportedConstructException;
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
import im.arun.pyfmt.model.Module;
import im.arun.pyfmt.model.Position;
import im.arun.pyfmt.model.Stmt;
import im.arun.pyfmt.model.UnaryOperator;
import im.arun.pyfmt.model.WithItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a Python {@code ast} tree serialized as JSON into the node model.
 *
 * <p>Every node is an object whose {@code _type} names the ast class, with the ast field
 * names as keys ({@code body}, {@code targets}, {@code lineno}, ...). Operators may be
 * either {@code {"_type": "Add"}} objects or plain strings. The pre-3.8 node names
 * {@code Str}, {@code Num}, {@code NameConstant}, {@code Ellipsis}, {@code Index} and
 * {@code ExtSlice} are accepted alongside {@code Constant}.
 */
public class JsonTreeReader {
    private static final Logger logger = LoggerFactory.getLogger(JsonTreeReader.class);

    private final ObjectMapper objectMapper;

    public JsonTreeReader() {
        // floats keep the digits they were written with: 1.0 must not come back as 1
        this.objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
    }

    public Module read(Path path) throws IOException {
        return read(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * @throws TreeParseException when the document is not JSON or lacks a required field
     * @throws UnsupportedConstructException for a node kind the formatter cannot render
     */
    public Module read(String json) throws TreeParseException {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TreeParseException("Malformed tree document: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new TreeParseException("Tree document must be a JSON object");
        }
        String type = type(root);
        if (!"Module".equals(type)) {
            throw new TreeParseException("Expected a Module at the root, found " + type);
        }
        Module module = new Module(statements(root, "body"));
        logger.debug("Read module with {} top-level statements", module.body().size());
        return module;
    }

    // -- statements -----------------------------------------------------------------------

    private List<Stmt> statements(JsonNode parent, String field) throws TreeParseException {
        List<Stmt> result = new ArrayList<>();
        for (JsonNode child : array(parent, field)) {
            result.add(statement(child));
        }
        return result;
    }

    private Stmt statement(JsonNode node) throws TreeParseException {
        String type = type(node);
        Position position = position(node);
        switch (type) {
            case "Expr":
                return new Stmt.ExprStatement(position, expr(node, "value"));
            case "Assign":
                return new Stmt.Assign(position, exprs(node, "targets"), expr(node, "value"));
            case "AugAssign":
                return new Stmt.AugAssign(position, expr(node, "target"), binaryOperator(node), expr(node, "value"));
            case "AnnAssign":
                return new Stmt.AnnAssign(position, expr(node, "target"), expr(node, "annotation"),
                        optionalExpr(node, "value"));
            case "FunctionDef":
            case "AsyncFunctionDef":
                return new Stmt.FunctionDef(position, text(node, "name"), arguments(required(node, "args")),
                        statements(node, "body"), exprs(node, "decorator_list"), optionalExpr(node, "returns"),
                        type.startsWith("Async"));
            case "ClassDef":
                return new Stmt.ClassDef(position, text(node, "name"), exprs(node, "bases"), keywords(node),
                        statements(node, "body"), exprs(node, "decorator_list"));
            case "If":
                return new Stmt.If(position, expr(node, "test"), statements(node, "body"), statements(node, "orelse"));
            case "For":
            case "AsyncFor":
                return new Stmt.For(position, expr(node, "target"), expr(node, "iter"), statements(node, "body"),
                        statements(node, "orelse"), type.startsWith("Async"));
            case "While":
                return new Stmt.While(position, expr(node, "test"), statements(node, "body"),
                        statements(node, "orelse"));
            case "Try":
                return new Stmt.Try(position, statements(node, "body"), handlers(node), statements(node, "orelse"),
                        statements(node, "finalbody"));
            case "With":
            case "AsyncWith":
                return new Stmt.With(position, withItems(node), statements(node, "body"), type.startsWith("Async"));
            case "Import":
                return new Stmt.Import(position, aliases(node));
            case "ImportFrom":
                return new Stmt.ImportFrom(position, optionalText(node, "module"), aliases(node),
                        node.path("level").asInt(0));
            case "Return":
                return new Stmt.Return(position, optionalExpr(node, "value"));
            case "Raise":
                return new Stmt.Raise(position, optionalExpr(node, "exc"), optionalExpr(node, "cause"));
            case "Assert":
                return new Stmt.Assert(position, expr(node, "test"), optionalExpr(node, "msg"));
            case "Delete":
                return new Stmt.Delete(position, exprs(node, "targets"));
            case "Global":
                return new Stmt.Global(position, names(node));
            case "Nonlocal":
                return new Stmt.Nonlocal(position, names(node));
            case "Pass":
                return new Stmt.Pass(position);
            case "Break":
                return new Stmt.Break(position);
            case "Continue":
                return new Stmt.Continue(position);
            default:
                throw new UnsupportedConstructException(type, position.line());
        }
    }

    private List<ExceptHandler> handlers(JsonNode node) throws TreeParseException {
        List<ExceptHandler> result = new ArrayList<>();
        for (JsonNode handler : array(node, "handlers")) {
            result.add(new ExceptHandler(position(handler), optionalExpr(handler, "type"),
                    optionalText(handler, "name"), statements(handler, "body")));
        }
        return result;
    }

    private List<WithItem> withItems(JsonNode node) throws TreeParseException {
        List<WithItem> result = new ArrayList<>();
        for (JsonNode item : array(node, "items")) {
            result.add(new WithItem(expr(item, "context_expr"), optionalExpr(item, "optional_vars")));
        }
        return result;
    }

    private List<Alias> aliases(JsonNode node) throws TreeParseException {
        List<Alias> result = new ArrayList<>();
        for (JsonNode alias : array(node, "names")) {
            result.add(new Alias(text(alias, "name"), optionalText(alias, "asname")));
        }
        return result;
    }

    private List<String> names(JsonNode node) throws TreeParseException {
        List<String> result = new ArrayList<>();
        for (JsonNode name : array(node, "names")) {
            result.add(name.asText());
        }
        return result;
    }

    private List<Keyword> keywords(JsonNode node) throws TreeParseException {
        List<Keyword> result = new ArrayList<>();
        for (JsonNode keyword : array(node, "keywords")) {
            result.add(new Keyword(optionalText(keyword, "arg"), expr(keyword, "value")));
        }
        return result;
    }

    private Arguments arguments(JsonNode node) throws TreeParseException {
        List<Expr> kwDefaults = new ArrayList<>();
        for (JsonNode value : array(node, "kw_defaults")) {
            kwDefaults.add(value.isNull() ? null : expression(value));
        }
        return new Arguments(args(node, "posonlyargs"), args(node, "args"), exprs(node, "defaults"),
                optionalArg(node, "vararg"), args(node, "kwonlyargs"), kwDefaults, optionalArg(node, "kwarg"));
    }

    private List<Arg> args(JsonNode node, String field) throws TreeParseException {
        List<Arg> result = new ArrayList<>();
        JsonNode values = node.path(field);
        if (values.isMissingNode() || values.isNull()) {
            return result;
        }
        for (JsonNode arg : array(node, field)) {
            result.add(arg(arg));
        }
        return result;
    }

    private Arg optionalArg(JsonNode node, String field) throws TreeParseException {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : arg(value);
    }

    private Arg arg(JsonNode node) throws TreeParseException {
        return new Arg(text(node, "arg"), optionalExpr(node, "annotation"));
    }

    // -- expressions ----------------------------------------------------------------------

    private Expr expr(JsonNode parent, String field) throws TreeParseException {
        return expression(required(parent, field));
    }

    private Expr optionalExpr(JsonNode parent, String field) throws TreeParseException {
        JsonNode value = parent.path(field);
        return value.isMissingNode() || value.isNull() ? null : expression(value);
    }

    private List<Expr> exprs(JsonNode parent, String field) throws TreeParseException {
        List<Expr> result = new ArrayList<>();
        for (JsonNode child : array(parent, field)) {
            result.add(child.isNull() ? null : expression(child));
        }
        return result;
    }

    private Expr expression(JsonNode node) throws TreeParseException {
        String type = type(node);
        switch (type) {
            case "Constant":
            case "NameConstant":
                if (!node.has("value")) {
                    throw new TreeParseException("Missing field 'value' in " + type + " at line " + position(node).line());
                }
                return constant(node, node.get("value"));
            case "Str":
                return new Expr.StringLiteral(text(node, "s"));
            case "Num":
                return new Expr.NumberLiteral(required(node, "n").asText());
            case "Ellipsis":
                return Expr.NameConstant.ELLIPSIS;
            case "Name":
                return new Expr.Name(text(node, "id"));
            case "Attribute":
                return new Expr.Attribute(expr(node, "value"), text(node, "attr"));
            case "Subscript":
                return new Expr.Subscript(expr(node, "value"), expr(node, "slice"));
            case "Index":
                return expr(node, "value");
            case "ExtSlice":
                return new Expr.TupleLiteral(exprs(node, "dims"));
            case "Slice":
                return new Expr.Slice(optionalExpr(node, "lower"), optionalExpr(node, "upper"),
                        optionalExpr(node, "step"));
            case "Call":
                return new Expr.Call(expr(node, "func"), exprs(node, "args"), keywords(node));
            case "Starred":
                return new Expr.Starred(expr(node, "value"));
            case "UnaryOp":
                return new Expr.UnaryOp(operator(node, UnaryOperator::fromAstName), expr(node, "operand"));
            case "BinOp":
                return new Expr.BinOp(expr(node, "left"), binaryOperator(node), expr(node, "right"));
            case "BoolOp":
                return new Expr.BoolOp(operator(node, BoolOperator::fromAstName), exprs(node, "values"));
            case "Compare":
                return new Expr.Compare(expr(node, "left"), compareOperators(node), exprs(node, "comparators"));
            case "IfExp":
                return new Expr.IfExp(expr(node, "test"), expr(node, "body"), expr(node, "orelse"));
            case "Lambda":
                return new Expr.Lambda(arguments(required(node, "args")), expr(node, "body"));
            case "NamedExpr":
                return new Expr.NamedExpr(expr(node, "target"), expr(node, "value"));
            case "List":
                return new Expr.ListLiteral(exprs(node, "elts"));
            case "Tuple":
                return new Expr.TupleLiteral(exprs(node, "elts"));
            case "Set":
                return new Expr.SetLiteral(exprs(node, "elts"));
            case "Dict":
                return new Expr.DictLiteral(exprs(node, "keys"), exprs(node, "values"));
            case "ListComp":
                return new Expr.ListComp(expr(node, "elt"), generators(node));
            case "SetComp":
                return new Expr.SetComp(expr(node, "elt"), generators(node));
            case "GeneratorExp":
                return new Expr.GeneratorExp(expr(node, "elt"), generators(node));
            case "DictComp":
                return new Expr.DictComp(expr(node, "key"), expr(node, "value"), generators(node));
            case "Yield":
                return new Expr.Yield(optionalExpr(node, "value"));
            case "YieldFrom":
                return new Expr.YieldFrom(expr(node, "value"));
            case "Await":
                return new Expr.Await(expr(node, "value"));
            default:
                throw new UnsupportedConstructException(type, position(node).line());
        }
    }

    private Expr constant(JsonNode node, JsonNode value) {
        if (value.isTextual()) {
            return new Expr.StringLiteral(value.asText());
        }
        if (value.isBoolean()) {
            return value.asBoolean() ? Expr.NameConstant.TRUE : Expr.NameConstant.FALSE;
        }
        if (value.isNull()) {
            return Expr.NameConstant.NONE;
        }
        if (value.isBigDecimal()) {
            return new Expr.NumberLiteral(value.decimalValue().toString().replace("E+", "e+").replace("E-", "e-"));
        }
        if (value.isNumber()) {
            return new Expr.NumberLiteral(value.asText());
        }
        if (value.isObject() && "Ellipsis".equals(value.path("_type").asText())) {
            return Expr.NameConstant.ELLIPSIS;
        }
        throw new UnsupportedConstructException("Constant(" + value.getNodeType() + ")", position(node).line());
    }

    private List<Comprehension> generators(JsonNode node) throws TreeParseException {
        List<Comprehension> result = new ArrayList<>();
        for (JsonNode generator : array(node, "generators")) {
            result.add(new Comprehension(expr(generator, "target"), expr(generator, "iter"),
                    exprs(generator, "ifs"), generator.path("is_async").asInt(0) != 0));
        }
        return result;
    }

    // -- operators ------------------------------------------------------------------------

    private interface OperatorLookup<T> {
        T fromAstName(String name);
    }

    private BinaryOperator binaryOperator(JsonNode node) throws TreeParseException {
        return operator(node, BinaryOperator::fromAstName);
    }

    private <T> T operator(JsonNode node, OperatorLookup<T> lookup) throws TreeParseException {
        String name = operatorName(required(node, "op"));
        T op = lookup.fromAstName(name);
        if (op == null) {
            throw new UnsupportedConstructException(name, position(node).line());
        }
        return op;
    }

    private List<CompareOperator> compareOperators(JsonNode node) throws TreeParseException {
        List<CompareOperator> result = new ArrayList<>();
        for (JsonNode op : array(node, "ops")) {
            String name = operatorName(op);
            CompareOperator compare = CompareOperator.fromAstName(name);
            if (compare == null) {
                throw new UnsupportedConstructException(name, position(node).line());
            }
            result.add(compare);
        }
        return result;
    }

    private static String operatorName(JsonNode op) {
        return op.isTextual() ? op.asText() : op.path("_type").asText();
    }

    // -- field access ---------------------------------------------------------------------

    private static String type(JsonNode node) throws TreeParseException {
        JsonNode type = node.get("_type");
        if (type == null || !type.isTextual()) {
            throw new TreeParseException("Node without _type at " + abbreviate(node));
        }
        return type.asText();
    }

    private static Position position(JsonNode node) {
        if (!node.has("lineno")) {
            return Position.NONE;
        }
        int line = node.path("lineno").asInt();
        return new Position(line, node.path("col_offset").asInt(0), Math.max(line, node.path("end_lineno").asInt(line)));
    }

    private static JsonNode required(JsonNode node, String field) throws TreeParseException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new TreeParseException("Missing field '" + field + "' in " + node.path("_type").asText("node")
                    + " at line " + position(node).line());
        }
        return value;
    }

    private static JsonNode array(JsonNode node, String field) throws TreeParseException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return JsonNodeFactory.instance.arrayNode();
        }
        if (!value.isArray()) {
            throw new TreeParseException("Field '" + field + "' of " + node.path("_type").asText("node")
                    + " must be a list");
        }
        return value;
    }

    private static String text(JsonNode node, String field) throws TreeParseException {
        return required(node, field).asText();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String abbreviate(JsonNode node) {
        String text = node.toString();
        return text.length() > 60 ? text.substring(0, 57) + "..." : text;
    }
}
