package org.asymptote.compiler.frontend.parser.ast.expr;

import org.asymptote.compiler.model.Token;

/**
 * A binary operation.
 *
 * @param token    The operator token.
 * @param operator The operator.
 * @param left     The left operand.
 * @param right    The right operand.
 */
public record BinaryExpr(Token token, BinaryOperator operator, Expression left, Expression right) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
