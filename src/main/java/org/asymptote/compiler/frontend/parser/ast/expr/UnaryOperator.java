package org.asymptote.compiler.frontend.parser.ast.expr;

public enum UnaryOperator {
    NEGATE("-"),
    NOT("NOT ");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
