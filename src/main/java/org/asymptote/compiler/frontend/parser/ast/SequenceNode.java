package org.asymptote.compiler.frontend.parser.ast;

import org.asymptote.compiler.model.Token;

import java.util.List;

/**
 * An ordered block of statements. The program root is always a sequence.
 *
 * @param token      The first token of the block (the opener for loop and branch bodies).
 * @param statements The statements in source order.
 */
public record SequenceNode(Token token, List<AstNode> statements) implements AstNode {

    public SequenceNode {
        statements = List.copyOf(statements);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSequence(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return statements;
    }
}
