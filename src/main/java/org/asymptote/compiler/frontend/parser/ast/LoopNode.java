package org.asymptote.compiler.frontend.parser.ast;

import org.asymptote.compiler.model.Token;

import java.util.List;

/**
 * A FOR, WHILE or REPEAT-UNTIL loop.
 *
 * @param token  The opening keyword.
 * @param kind   The loop form.
 * @param bounds The iteration bounds; {@link RangeBounds} for FOR, {@link ConditionBounds} otherwise.
 * @param body   The loop body.
 */
public record LoopNode(Token token, LoopKind kind, LoopBounds bounds, SequenceNode body) implements AstNode {

    public LoopNode {
        if ((kind == LoopKind.FOR) != (bounds instanceof RangeBounds)) {
            throw new IllegalArgumentException(kind + " loop cannot carry " + bounds.getClass().getSimpleName());
        }
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLoop(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(body);
    }
}
