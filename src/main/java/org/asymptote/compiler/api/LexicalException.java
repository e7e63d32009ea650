package org.asymptote.compiler.api;

/**
 * Thrown by the lexer when it meets a character that starts no token.
 */
public class LexicalException extends AnalysisException {

    private final String offendingCharacter;
    private final int line;
    private final int column;

    /**
     * @param offendingCharacter The unrecognized character (a full code point).
     * @param line               The 1-based line of the character.
     * @param column             The 1-based column of the character.
     */
    public LexicalException(String offendingCharacter, int line, int column) {
        super("Illegal character '" + offendingCharacter + "' at line " + line + ", column " + column);
        this.offendingCharacter = offendingCharacter;
        this.line = line;
        this.column = column;
    }

    public String getOffendingCharacter() {
        return offendingCharacter;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
