package org.asymptote.compiler.frontend.parser.features.cond;

import org.asymptote.compiler.frontend.parser.IStatementHandler;
import org.asymptote.compiler.frontend.parser.ParsingContext;
import org.asymptote.compiler.frontend.parser.ast.AstNode;
import org.asymptote.compiler.frontend.parser.ast.ConditionalNode;
import org.asymptote.compiler.frontend.parser.ast.SequenceNode;
import org.asymptote.compiler.frontend.parser.ast.expr.Expression;
import org.asymptote.compiler.model.Token;
import org.asymptote.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a conditional with any number of {@code ELSE IF} branches.
 *
 * <p>Syntax: {@code IF c THEN ... [ELSE IF c THEN ...]* [ELSE ...] END IF}
 *
 * <p>An {@code ELSE IF} chain shares the single {@code END IF} of the outer statement. {@code IF} only
 * continues the chain when it is on the same line as its {@code ELSE}; on the next line it opens a
 * nested conditional with its own {@code END IF}.
 */
public class IfStatementHandler implements IStatementHandler {

    private static final String BRANCH_CLOSER = "ELSE or END IF";

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance(); // consume IF

        List<ConditionalNode.Branch> branches = new ArrayList<>();
        branches.add(branch(context, keyword));

        SequenceNode elseBody = null;
        while (context.match(TokenType.ELSE)) {
            Token elseToken = context.previous();
            if (context.check(TokenType.IF) && context.peek().line() == elseToken.line()) {
                branches.add(branch(context, context.advance()));
            } else {
                elseBody = context.block(elseToken, "END IF", TokenType.END);
                break;
            }
        }
        context.closeBlock(keyword, TokenType.IF);

        return new ConditionalNode(keyword, branches, elseBody);
    }

    private static ConditionalNode.Branch branch(ParsingContext context, Token opener) {
        Expression condition = context.expression();
        context.consume(TokenType.THEN, "THEN");
        SequenceNode body = context.block(opener, BRANCH_CLOSER, TokenType.ELSE, TokenType.END);
        return new ConditionalNode.Branch(condition, body);
    }
}
