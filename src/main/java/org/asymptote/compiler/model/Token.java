package org.asymptote.compiler.model;

/**
 * A single lexical token. Immutable once produced.
 *
 * @param type   The token kind.
 * @param text   The lexeme as written in the source. Keywords keep their original casing.
 * @param value  The literal value for {@link TokenType#NUMBER} tokens ({@link Long} or {@link Double}), otherwise null.
 * @param line   The 1-based line of the first character.
 * @param column The 1-based column of the first character, counted in code points.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column
) {

    /**
     * @return a human-readable description used in diagnostics, e.g. {@code 'END' (END)}.
     */
    public String describe() {
        if (type == TokenType.EOF) {
            return "end of input";
        }
        return "'" + text + "' (" + type + ")";
    }

    /**
     * @return the position as {@code line:column}.
     */
    public String position() {
        return line + ":" + column;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position();
    }
}
