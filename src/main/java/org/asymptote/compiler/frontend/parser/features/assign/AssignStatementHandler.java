package org.asymptote.compiler.frontend.parser.features.assign;

import org.asymptote.compiler.frontend.parser.IStatementHandler;
import org.asymptote.compiler.frontend.parser.ParsingContext;
import org.asymptote.compiler.frontend.parser.ast.AssignNode;
import org.asymptote.compiler.frontend.parser.ast.AstNode;
import org.asymptote.compiler.frontend.parser.ast.expr.Expression;
import org.asymptote.compiler.frontend.parser.ast.expr.VariableRef;
import org.asymptote.compiler.model.Token;
import org.asymptote.compiler.model.TokenType;

/**
 * Parses an assignment.
 *
 * <p>Syntax: {@code name ← value} or {@code name[i][j] ← value}
 */
public class AssignStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token name = context.consume(TokenType.IDENTIFIER, "a variable name");
        Expression target = context.indices(new VariableRef(name, name.text()));
        context.consume(TokenType.ASSIGN, "an assignment arrow '←'");
        return new AssignNode(name, target, context.expression());
    }
}
