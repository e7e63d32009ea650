package org.asymptote.compiler.frontend.parser;

import org.asymptote.compiler.model.Token;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * Explicit stack of open block openers. Every opener pushed must be popped by its
 * matching closer before the parser may return a tree.
 */
class BlockTracker {

    private final Deque<Token> openers = new ArrayDeque<>();

    void open(Token opener) {
        openers.push(opener);
    }

    Token close() {
        if (openers.isEmpty()) {
            throw new IllegalStateException("No open block to close");
        }
        return openers.pop();
    }

    boolean isEmpty() {
        return openers.isEmpty();
    }

    static String describe(Token opener) {
        return opener.text().toUpperCase(Locale.ROOT) + " opened at line " + opener.line()
                + ", column " + opener.column();
    }
}
