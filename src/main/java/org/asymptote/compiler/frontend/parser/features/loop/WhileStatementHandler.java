package org.asymptote.compiler.frontend.parser.features.loop;

import org.asymptote.compiler.frontend.parser.IStatementHandler;
import org.asymptote.compiler.frontend.parser.ParsingContext;
import org.asymptote.compiler.frontend.parser.ast.AstNode;
import org.asymptote.compiler.frontend.parser.ast.ConditionBounds;
import org.asymptote.compiler.frontend.parser.ast.LoopKind;
import org.asymptote.compiler.frontend.parser.ast.LoopNode;
import org.asymptote.compiler.frontend.parser.ast.SequenceNode;
import org.asymptote.compiler.frontend.parser.ast.expr.Expression;
import org.asymptote.compiler.model.Token;
import org.asymptote.compiler.model.TokenType;

/**
 * Parses {@code WHILE condition DO ... END WHILE}.
 */
public class WhileStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance(); // consume WHILE
        Expression condition = context.expression();
        context.consume(TokenType.DO, "DO");

        SequenceNode body = context.block(keyword, "END WHILE", TokenType.END);
        context.closeBlock(keyword, TokenType.WHILE);

        return new LoopNode(keyword, LoopKind.WHILE, new ConditionBounds(condition), body);
    }
}
