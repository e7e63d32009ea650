package org.asymptote.compiler.frontend.parser.ast;

import org.asymptote.compiler.frontend.parser.ast.expr.Expression;
import org.asymptote.compiler.model.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An {@code IF ... THEN ... [ELSE IF ...]* [ELSE ...] END IF} statement.
 *
 * @param token    The IF keyword.
 * @param branches The guarded branches in source order, at least one.
 * @param elseBody The ELSE body, or null when absent.
 */
public record ConditionalNode(Token token, List<Branch> branches, SequenceNode elseBody) implements AstNode {

    /**
     * One guarded branch.
     *
     * @param condition The guard.
     * @param body      The statements executed when the guard holds.
     */
    public record Branch(Expression condition, SequenceNode body) {
    }

    public ConditionalNode {
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("A conditional needs at least one branch");
        }
        branches = List.copyOf(branches);
    }

    public Optional<SequenceNode> elseBranch() {
        return Optional.ofNullable(elseBody);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        for (Branch branch : branches) {
            children.add(branch.body());
        }
        if (elseBody != null) {
            children.add(elseBody);
        }
        return children;
    }
}
