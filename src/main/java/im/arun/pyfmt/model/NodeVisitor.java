package im.arun.pyfmt.model;

/**
 * Exhaustive dispatch over the node family. {@code P} is the per-call parameter threaded
 * through the traversal.
 */
public interface NodeVisitor<R, P> {

    R visitModule(Module node, P param);

    R visitKeyword(Keyword node, P param);

    R visitArguments(Arguments node, P param);

    R visitArg(Arg node, P param);

    R visitAlias(Alias node, P param);

    R visitComprehension(Comprehension node, P param);

    R visitExceptHandler(ExceptHandler node, P param);

    R visitWithItem(WithItem node, P param);

    // expressions

    R visitStringLiteral(Expr.StringLiteral node, P param);

    R visitNumberLiteral(Expr.NumberLiteral node, P param);

    R visitNameConstant(Expr.NameConstant node, P param);

    R visitName(Expr.Name node, P param);

    R visitAttribute(Expr.Attribute node, P param);

    R visitSubscript(Expr.Subscript node, P param);

    R visitSlice(Expr.Slice node, P param);

    R visitCall(Expr.Call node, P param);

    R visitStarred(Expr.Starred node, P param);

    R visitUnaryOp(Expr.UnaryOp node, P param);

    R visitBinOp(Expr.BinOp node, P param);

    R visitBoolOp(Expr.BoolOp node, P param);

    R visitCompare(Expr.Compare node, P param);

    R visitIfExp(Expr.IfExp node, P param);

    R visitLambda(Expr.Lambda node, P param);

    R visitNamedExpr(Expr.NamedExpr node, P param);

    R visitListLiteral(Expr.ListLiteral node, P param);

    R visitTupleLiteral(Expr.TupleLiteral node, P param);

    R visitSetLiteral(Expr.SetLiteral node, P param);

    R visitDictLiteral(Expr.DictLiteral node, P param);

    R visitListComp(Expr.ListComp node, P param);

    R visitSetComp(Expr.SetComp node, P param);

    R visitGeneratorExp(Expr.GeneratorExp node, P param);

    R visitDictComp(Expr.DictComp node, P param);

    R visitYield(Expr.Yield node, P param);

    R visitYieldFrom(Expr.YieldFrom node, P param);

    R visitAwait(Expr.Await node, P param);

    // statements

    R visitExprStatement(Stmt.ExprStatement node, P param);

    R visitAssign(Stmt.Assign node, P param);

    R visitAugAssign(Stmt.AugAssign node, P param);

    R visitAnnAssign(Stmt.AnnAssign node, P param);

    R visitFunctionDef(Stmt.FunctionDef node, P param);

    R visitClassDef(Stmt.ClassDef node, P param);

    R visitIf(Stmt.If node, P param);

    R visitFor(Stmt.For node, P param);

    R visitWhile(Stmt.While node, P param);

    R visitTry(Stmt.Try node, P param);

    R visitWith(Stmt.With node, P param);

    R visitImport(Stmt.Import node, P param);

    R visitImportFrom(Stmt.ImportFrom node, P param);

    R visitReturn(Stmt.Return node, P param);

    R visitRaise(Stmt.Raise node, P param);

    R visitAssert(Stmt.Assert node, P param);

    R visitDelete(Stmt.Delete node, P param);

    R visitGlobal(Stmt.Global node, P param);

    R visitNonlocal(Stmt.Nonlocal node, P param);

    R visitPass(Stmt.Pass node, P param);

    R visitBreak(Stmt.Break node, P param);

    R visitContinue(Stmt.Continue node, P param);
}
