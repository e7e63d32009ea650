package org.asymptote.compiler.frontend.parser.features.call;

import org.asymptote.compiler.frontend.parser.IStatementHandler;
import org.asymptote.compiler.frontend.parser.ParsingContext;
import org.asymptote.compiler.frontend.parser.ast.AstNode;
import org.asymptote.compiler.frontend.parser.ast.CallNode;
import org.asymptote.compiler.frontend.parser.ast.expr.Expression;
import org.asymptote.compiler.model.Token;
import org.asymptote.compiler.model.TokenType;

import java.util.List;

/**
 * Parses {@code CALL name(arguments)}.
 *
 * <p>The call is flagged recursive when the callee is the routine currently being defined,
 * compared case-insensitively.
 */
public class CallStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance(); // consume CALL
        Token name = context.consume(TokenType.IDENTIFIER, "a routine name");
        context.consume(TokenType.LEFT_PAREN, "'('");
        List<Expression> arguments = context.arguments(name);

        String enclosing = context.currentRoutine();
        boolean recursive = enclosing != null && enclosing.equalsIgnoreCase(name.text());
        return new CallNode(keyword, name.text(), arguments, recursive);
    }
}
