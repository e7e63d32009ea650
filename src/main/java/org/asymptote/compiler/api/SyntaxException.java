package org.asymptote.compiler.api;

import org.asymptote.compiler.model.Token;

/**
 * Thrown by the parser at the first structural violation: an unexpected token,
 * or an unmatched block opener or closer. No partial tree is ever returned.
 */
public class SyntaxException extends AnalysisException {

    private final String expected;
    private final String found;
    private final int line;
    private final int column;

    /**
     * @param expected What the grammar required at this point, e.g. {@code END FOR}.
     * @param found    The token that was found instead.
     * @param detail   Additional context appended to the message, may be null.
     */
    public SyntaxException(String expected, Token found, String detail) {
        super("Expected " + expected + " but found " + found.describe()
                + " at line " + found.line() + ", column " + found.column()
                + (detail != null ? " (" + detail + ")" : ""));
        this.expected = expected;
        this.found = found.describe();
        this.line = found.line();
        this.column = found.column();
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
