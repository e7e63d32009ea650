package org.asymptote.compiler.frontend.parser;

import org.asymptote.compiler.frontend.parser.ast.AstNode;

/**
 * Handler interface for one statement production, selected by the leading token.
 * The grammar is LL(1) on that token, so a handler never has to backtrack.
 */
public interface IStatementHandler {

    /**
     * Parses the statement starting at the current token.
     *
     * @param context The parsing context providing access to the token stream.
     * @return The AST node for the statement, never null.
     */
    AstNode parse(ParsingContext context);
}
