package org.asymptote.compiler.frontend.parser.features.routine;

import org.asymptote.compiler.api.SyntaxException;
import org.asymptote.compiler.frontend.parser.IStatementHandler;
import org.asymptote.compiler.frontend.parser.ParsingContext;
import org.asymptote.compiler.frontend.parser.ast.AstNode;
import org.asymptote.compiler.frontend.parser.ast.RoutineNode;
import org.asymptote.compiler.frontend.parser.ast.SequenceNode;
import org.asymptote.compiler.model.Token;
import org.asymptote.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a routine definition.
 *
 * <p>Syntax: {@code FUNCTION|PROCEDURE name(p1, p2, ...) ... END FUNCTION|PROCEDURE}
 *
 * <p>Definitions are only legal at top level. Array parameters may be written {@code A[]}.
 */
public class RoutineStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance(); // consume FUNCTION or PROCEDURE
        if (!context.isTopLevel()) {
            throw new SyntaxException("a statement", keyword, "routine definitions are only allowed at top level");
        }

        Token name = context.consume(TokenType.IDENTIFIER, "a routine name");
        context.consume(TokenType.LEFT_PAREN, "'('");
        List<String> parameters = new ArrayList<>();
        if (!context.check(TokenType.RIGHT_PAREN)) {
            do {
                Token parameter = context.consume(TokenType.IDENTIFIER, "a parameter name");
                if (context.match(TokenType.LEFT_BRACKET)) {
                    context.consume(TokenType.RIGHT_BRACKET, "']'");
                }
                parameters.add(parameter.text());
                context.checkFanOut(parameters.size(), name);
            } while (context.match(TokenType.COMMA));
        }
        context.consume(TokenType.RIGHT_PAREN, "')'");

        TokenType kind = keyword.type();
        context.beginRoutine(name.text());
        try {
            SequenceNode body = context.block(keyword, "END " + kind, TokenType.END);
            context.closeBlock(keyword, kind);
            return new RoutineNode(keyword, name.text(), parameters, body);
        } finally {
            context.endRoutine();
        }
    }
}
