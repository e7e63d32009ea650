package org.asymptote.compiler.frontend.parser.ast.expr;

import org.asymptote.compiler.model.Token;

/**
 * A prefix operation, arithmetic negation or logical NOT.
 */
public record UnaryExpr(Token token, UnaryOperator operator, Expression operand) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}
