package org.asymptote.compiler.frontend.parser.ast;

import org.asymptote.compiler.frontend.parser.ast.expr.Expression;
import org.asymptote.compiler.frontend.parser.ast.expr.IndexExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.VariableRef;
import org.asymptote.compiler.model.Token;

/**
 * An assignment {@code target ← value}.
 *
 * @param token  The token of the target identifier.
 * @param target The assigned location, a {@link VariableRef} or an {@link IndexExpr}.
 * @param value  The assigned expression.
 */
public record AssignNode(Token token, Expression target, Expression value) implements AstNode {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAssign(this);
    }

    /**
     * @return the assigned variable name, or null when an array element is assigned.
     */
    public String targetVariable() {
        return target instanceof VariableRef ref ? ref.name() : null;
    }
}
