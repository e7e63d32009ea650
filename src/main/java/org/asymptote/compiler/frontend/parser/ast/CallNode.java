package org.asymptote.compiler.frontend.parser.ast;

import org.asymptote.compiler.frontend.parser.ast.expr.Expression;
import org.asymptote.compiler.model.Token;

import java.util.List;

/**
 * A routine call {@code CALL name(arguments)}.
 *
 * @param token     The CALL keyword.
 * @param name      The callee name as written.
 * @param arguments The argument expressions.
 * @param recursive True when the parser resolved the callee to the enclosing routine.
 */
public record CallNode(Token token, String name, List<Expression> arguments, boolean recursive) implements AstNode {

    public CallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
