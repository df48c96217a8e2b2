package com.jnix.expr;

/**
 * Visitor over {@link NExpr} node shapes, one method per shape.
 *
 * @param <R> the result type
 */
public interface NExprVisitor<R> {
    R visitConstant(NExpr.Constant constant);

    R visitStr(NExpr.Str str);

    R visitIndentedStr(NExpr.IndentedStr str);

    R visitLiteralPath(NExpr.LiteralPath path);

    R visitEnvPath(NExpr.EnvPath path);

    R visitSym(NExpr.Sym sym);

    R visitSynHole(NExpr.SynHole hole);

    R visitUnary(NExpr.Unary unary);

    R visitBinary(NExpr.Binary binary);

    R visitSelect(NExpr.Select select);

    R visitHasAttr(NExpr.HasAttr hasAttr);

    R visitAttrSet(NExpr.AttrSet set);

    R visitList(NExpr.ListExpr list);

    R visitLet(NExpr.Let let);

    R visitWith(NExpr.With with);

    R visitAssert(NExpr.Assert assertion);

    R visitIf(NExpr.If ifExpr);

    R visitLambda(NExpr.Lambda lambda);
}
