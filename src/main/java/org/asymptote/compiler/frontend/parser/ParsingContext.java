package org.asymptote.compiler.frontend.parser;

import org.asymptote.compiler.api.SyntaxException;
import org.asymptote.compiler.frontend.parser.ast.SequenceNode;
import org.asymptote.compiler.frontend.parser.ast.expr.Expression;
import org.asymptote.compiler.model.Token;
import org.asymptote.compiler.model.TokenType;

import java.util.List;

/**
 * Provides statement handlers with access to the token stream and to the shared
 * block and expression parsing of the {@link Parser}.
 * This interface decouples handlers from the concrete parser implementation.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matched and was consumed.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type.
     */
    boolean check(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type.
     * @param type     The expected token type.
     * @param expected A description of what was expected, e.g. {@code 'DO'}.
     * @return The consumed token.
     * @throws SyntaxException if the current token has a different type.
     */
    Token consume(TokenType type, String expected);

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if the current token is EOF.
     */
    boolean isAtEnd();

    /**
     * Parses one full expression.
     * @return The expression tree.
     */
    Expression expression();

    /**
     * Parses zero or more {@code [index]} suffixes applied to {@code target}.
     */
    Expression indices(Expression target);

    /**
     * Parses a comma-separated argument list after an already consumed {@code (}, including the closing {@code )}.
     * @param owner The token naming the callee, for fan-out diagnostics.
     */
    List<Expression> arguments(Token owner);

    /**
     * Parses the statements of a block opened by {@code opener} up to, but not including,
     * one of the given closer tokens.
     *
     * @param opener         The keyword that opened the block, used for diagnostics and depth tracking.
     * @param expectedCloser A description of the closer, e.g. {@code END FOR}.
     * @param closers        The token types that may legally end this block.
     * @return The block body.
     * @throws SyntaxException if the block is ended by anything but one of the closers.
     */
    SequenceNode block(Token opener, String expectedCloser, TokenType... closers);

    /**
     * Consumes {@code END <kind>} for the block opened by {@code opener}.
     * @throws SyntaxException if the closer is missing or closes a different kind of block.
     */
    void closeBlock(Token opener, TokenType kind);

    /**
     * @return true if no block and no routine is currently open.
     */
    boolean isTopLevel();

    /**
     * @return the name of the routine whose body is being parsed, or null at top level.
     */
    String currentRoutine();

    /**
     * Marks the start of a routine body.
     */
    void beginRoutine(String name);

    /**
     * Marks the end of the current routine body.
     */
    void endRoutine();

    /**
     * Verifies a list length against the fan-out budget.
     * @param count The number of elements parsed so far.
     * @param at    The token the list belongs to.
     */
    void checkFanOut(int count, Token at);
}
