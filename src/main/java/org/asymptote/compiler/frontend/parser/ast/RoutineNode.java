package org.asymptote.compiler.frontend.parser.ast;

import org.asymptote.compiler.model.Token;

import java.util.List;

/**
 * A top-level {@code FUNCTION} or {@code PROCEDURE} definition. Definitions are declarations:
 * they contribute cost only where they are called.
 *
 * @param token      The FUNCTION or PROCEDURE keyword.
 * @param name       The routine name.
 * @param parameters The parameter names in order.
 * @param body       The routine body.
 */
public record RoutineNode(Token token, String name, List<String> parameters, SequenceNode body) implements AstNode {

    public RoutineNode {
        parameters = List.copyOf(parameters);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRoutine(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(body);
    }
}
