package org.asymptote.compiler.model;

/**
 * Token kinds produced by the {@link org.asymptote.compiler.frontend.lexer.Lexer}.
 */
public enum TokenType {
    // Keywords
    FOR, TO, DOWNTO, STEP, DO, WHILE, REPEAT, UNTIL, IF, THEN, ELSE, END,
    CALL, RETURN, FUNCTION, PROCEDURE, AND, OR, NOT, DIV, MOD, TRUE, FALSE,

    // Literals and names
    IDENTIFIER, NUMBER,

    // Assignment arrow (every accepted encoding)
    ASSIGN,

    // Arithmetic operators
    PLUS, MINUS, STAR, SLASH, CARET,

    // Comparison operators
    EQUAL, NOT_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,

    // Punctuation
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, COMMA, SEMICOLON,

    EOF;

    /**
     * @return true if this kind is one of the reserved words.
     */
    public boolean isKeyword() {
        return ordinal() <= FALSE.ordinal();
    }

    /**
     * @return true if this kind is a comparison operator.
     */
    public boolean isComparison() {
        return switch (this) {
            case EQUAL, NOT_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL -> true;
            default -> false;
        };
    }
}
