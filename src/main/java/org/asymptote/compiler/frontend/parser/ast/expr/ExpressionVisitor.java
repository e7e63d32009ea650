package org.asymptote.compiler.frontend.parser.ast.expr;

/**
 * Exhaustive dispatch over the expression node kinds.
 *
 * @param <R> The result type of the traversal.
 */
public interface ExpressionVisitor<R> {

    R visitLiteral(Literal literal);

    R visitVariable(VariableRef variable);

    R visitIndex(IndexExpr index);

    R visitBinary(BinaryExpr binary);

    R visitUnary(UnaryExpr unary);

    R visitApply(ApplyExpr apply);
}
