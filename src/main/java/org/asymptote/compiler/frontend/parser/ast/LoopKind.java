package org.asymptote.compiler.frontend.parser.ast;

import org.asymptote.compiler.model.TokenType;

/**
 * The three loop forms of the dialect.
 */
public enum LoopKind {
    FOR(TokenType.FOR),
    WHILE(TokenType.WHILE),
    REPEAT_UNTIL(TokenType.REPEAT);

    private final TokenType opener;

    LoopKind(TokenType opener) {
        this.opener = opener;
    }

    /**
     * @return the keyword that opens this loop.
     */
    public TokenType opener() {
        return opener;
    }
}
