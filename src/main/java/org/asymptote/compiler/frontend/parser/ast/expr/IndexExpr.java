package org.asymptote.compiler.frontend.parser.ast.expr;

import org.asymptote.compiler.model.Token;

/**
 * An element access {@code target[index]}. Multi-dimensional access nests.
 */
public record IndexExpr(Token token, Expression target, Expression index) implements Expression {

    /**
     * @return the name of the indexed array, unwrapping nested accesses.
     */
    public String baseName() {
        Expression base = target;
        while (base instanceof IndexExpr nested) {
            base = nested.target();
        }
        return base instanceof VariableRef ref ? ref.name() : null;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIndex(this);
    }
}
