package org.asymptote.compiler.frontend.parser.features.ret;

import org.asymptote.compiler.frontend.parser.IStatementHandler;
import org.asymptote.compiler.frontend.parser.ParsingContext;
import org.asymptote.compiler.frontend.parser.ast.AstNode;
import org.asymptote.compiler.frontend.parser.ast.ReturnNode;
import org.asymptote.compiler.frontend.parser.ast.expr.Expression;
import org.asymptote.compiler.model.Token;
import org.asymptote.compiler.model.TokenType;

/**
 * Parses {@code RETURN [value]}. The value must start on the same line as the keyword,
 * otherwise the next line is taken as the following statement.
 */
public class ReturnStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance(); // consume RETURN
        Token next = context.peek();
        Expression value = null;
        if (next.line() == keyword.line() && startsExpression(next.type())) {
            value = context.expression();
        }
        return new ReturnNode(keyword, value);
    }

    private static boolean startsExpression(TokenType type) {
        return switch (type) {
            case NUMBER, TRUE, FALSE, IDENTIFIER, LEFT_PAREN, MINUS, NOT -> true;
            default -> false;
        };
    }
}
