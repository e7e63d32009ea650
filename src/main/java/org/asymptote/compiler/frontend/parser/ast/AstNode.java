package org.asymptote.compiler.frontend.parser.ast;

import org.asymptote.compiler.model.Token;

import java.util.List;

/**
 * The closed set of statement nodes produced by the parser.
 * <p>
 * Consumers dispatch through {@link AstVisitor}; the hierarchy is sealed so that a new
 * statement kind cannot be added without every visitor failing to compile. Nodes are
 * immutable and identity-stable for the lifetime of one analysis. Expressions form their
 * own closed family, see {@link org.asymptote.compiler.frontend.parser.ast.expr.Expression}.
 */
public sealed interface AstNode
        permits SequenceNode, AssignNode, LoopNode, ConditionalNode, CallNode, RoutineNode, ReturnNode {

    /**
     * @return the token this node starts at, used for source positions.
     */
    Token token();

    /**
     * Dispatches to the visitor method for this node kind.
     */
    <R> R accept(AstVisitor<R> visitor);

    /**
     * @return the direct statement children of this node, in source order.
     */
    default List<AstNode> getChildren() {
        return List.of();
    }

    default int line() {
        return token().line();
    }

    default int column() {
        return token().column();
    }
}
