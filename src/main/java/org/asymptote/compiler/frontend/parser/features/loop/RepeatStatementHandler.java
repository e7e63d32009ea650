package org.asymptote.compiler.frontend.parser.features.loop;

import org.asymptote.compiler.frontend.parser.IStatementHandler;
import org.asymptote.compiler.frontend.parser.ParsingContext;
import org.asymptote.compiler.frontend.parser.ast.AstNode;
import org.asymptote.compiler.frontend.parser.ast.ConditionBounds;
import org.asymptote.compiler.frontend.parser.ast.LoopKind;
import org.asymptote.compiler.frontend.parser.ast.LoopNode;
import org.asymptote.compiler.frontend.parser.ast.SequenceNode;
import org.asymptote.compiler.model.Token;
import org.asymptote.compiler.model.TokenType;

/**
 * Parses {@code REPEAT ... UNTIL condition}. The body runs at least once.
 */
public class RepeatStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance(); // consume REPEAT

        SequenceNode body = context.block(keyword, "UNTIL", TokenType.UNTIL);
        context.consume(TokenType.UNTIL, "UNTIL");

        return new LoopNode(keyword, LoopKind.REPEAT_UNTIL, new ConditionBounds(context.expression()), body);
    }
}
