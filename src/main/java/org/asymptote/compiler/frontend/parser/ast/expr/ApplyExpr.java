package org.asymptote.compiler.frontend.parser.ast.expr;

import org.asymptote.compiler.model.Token;

import java.util.List;

/**
 * A function application inside an expression, e.g. {@code length(A)} or {@code floor(n / 2)}.
 * The analyzer treats it as constant-time; only {@code CALL} statements carry routine cost.
 */
public record ApplyExpr(Token token, String function, List<Expression> arguments) implements Expression {

    public ApplyExpr {
        arguments = List.copyOf(arguments);
    }

    /**
     * @param name A function name.
     * @return true if this applies the given function, ignoring case.
     */
    public boolean isFunction(String name) {
        return function.equalsIgnoreCase(name);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitApply(this);
    }
}
