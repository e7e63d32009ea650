package org.asymptote.compiler.frontend.parser.features.loop;

import org.asymptote.compiler.api.SyntaxException;
import org.asymptote.compiler.frontend.parser.IStatementHandler;
import org.asymptote.compiler.frontend.parser.ParsingContext;
import org.asymptote.compiler.frontend.parser.ast.AstNode;
import org.asymptote.compiler.frontend.parser.ast.LoopKind;
import org.asymptote.compiler.frontend.parser.ast.LoopNode;
import org.asymptote.compiler.frontend.parser.ast.RangeBounds;
import org.asymptote.compiler.frontend.parser.ast.SequenceNode;
import org.asymptote.compiler.frontend.parser.ast.expr.Expression;
import org.asymptote.compiler.model.Token;
import org.asymptote.compiler.model.TokenType;

/**
 * Parses a counted loop.
 *
 * <p>Syntax: {@code FOR i ← start TO|DOWNTO end [STEP s] DO ... END FOR}
 */
public class ForStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance(); // consume FOR

        Token variable = context.consume(TokenType.IDENTIFIER, "a loop variable");
        context.consume(TokenType.ASSIGN, "an assignment arrow '←'");
        Expression start = context.expression();

        boolean descending;
        if (context.match(TokenType.TO)) {
            descending = false;
        } else if (context.match(TokenType.DOWNTO)) {
            descending = true;
        } else {
            throw new SyntaxException("TO or DOWNTO", context.peek(), null);
        }
        Expression end = context.expression();
        Expression step = context.match(TokenType.STEP) ? context.expression() : null;
        context.consume(TokenType.DO, "DO");

        SequenceNode body = context.block(keyword, "END FOR", TokenType.END);
        context.closeBlock(keyword, TokenType.FOR);

        return new LoopNode(keyword, LoopKind.FOR,
                new RangeBounds(variable.text(), start, end, step, descending), body);
    }
}
