package org.asymptote.compiler.frontend.parser.ast.expr;

import org.asymptote.compiler.model.Token;

/**
 * The closed set of expression nodes: operands and operator trees used in bounds,
 * conditions, assigned values and call arguments.
 */
public sealed interface Expression permits Literal, VariableRef, IndexExpr, BinaryExpr, UnaryExpr, ApplyExpr {

    /**
     * @return the token this expression starts at (the operator token for binary expressions).
     */
    Token token();

    <R> R accept(ExpressionVisitor<R> visitor);

    default int line() {
        return token().line();
    }

    default int column() {
        return token().column();
    }
}
