package org.asymptote.compiler.frontend.parser.ast;

import org.asymptote.compiler.frontend.parser.ast.expr.Expression;
import org.asymptote.compiler.model.Token;

/**
 * A {@code RETURN [value]} statement.
 *
 * @param token The RETURN keyword.
 * @param value The returned expression, or null.
 */
public record ReturnNode(Token token, Expression value) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }
}
