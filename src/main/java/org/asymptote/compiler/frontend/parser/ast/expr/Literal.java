package org.asymptote.compiler.frontend.parser.ast.expr;

import org.asymptote.compiler.model.Token;

/**
 * A numeric or boolean literal.
 *
 * @param token The literal token.
 * @param value A {@link Long}, {@link Double} or {@link Boolean}.
 */
public record Literal(Token token, Object value) implements Expression {

    public boolean isNumeric() {
        return value instanceof Number;
    }

    /**
     * @return the numeric value.
     * @throws IllegalStateException if this is a boolean literal.
     */
    public double numericValue() {
        if (!(value instanceof Number number)) {
            throw new IllegalStateException("Not a numeric literal: " + value);
        }
        return number.doubleValue();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
