package org.asymptote.compiler.frontend.parser.ast.expr;

import org.asymptote.compiler.model.TokenType;

/**
 * Binary operators with their canonical rendering.
 */
public enum BinaryOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    INT_DIVIDE("DIV"),
    MODULO("MOD"),
    POWER("^"),
    EQUAL("="),
    NOT_EQUAL("≠"),
    LESS("<"),
    LESS_EQUAL("≤"),
    GREATER(">"),
    GREATER_EQUAL("≥"),
    AND("AND"),
    OR("OR");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isComparison() {
        return switch (this) {
            case EQUAL, NOT_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL -> true;
            default -> false;
        };
    }

    /**
     * @return the comparison that holds with both operands swapped, e.g. {@code <} for {@code >}.
     */
    public BinaryOperator mirrored() {
        return switch (this) {
            case LESS -> GREATER;
            case LESS_EQUAL -> GREATER_EQUAL;
            case GREATER -> LESS;
            case GREATER_EQUAL -> LESS_EQUAL;
            default -> this;
        };
    }

    /**
     * @return the logical negation of a comparison, e.g. {@code ≥} for {@code <}.
     */
    public BinaryOperator negated() {
        return switch (this) {
            case EQUAL -> NOT_EQUAL;
            case NOT_EQUAL -> EQUAL;
            case LESS -> GREATER_EQUAL;
            case LESS_EQUAL -> GREATER;
            case GREATER -> LESS_EQUAL;
            case GREATER_EQUAL -> LESS;
            case AND -> OR;
            case OR -> AND;
            default -> throw new IllegalStateException(this + " has no logical negation");
        };
    }

    /**
     * Maps an operator token onto its binary operator.
     *
     * @throws IllegalArgumentException if the token is not a binary operator.
     */
    public static BinaryOperator fromToken(TokenType type) {
        return switch (type) {
            case PLUS -> ADD;
            case MINUS -> SUBTRACT;
            case STAR -> MULTIPLY;
            case SLASH -> DIVIDE;
            case DIV -> INT_DIVIDE;
            case MOD -> MODULO;
            case CARET -> POWER;
            case EQUAL -> EQUAL;
            case NOT_EQUAL -> NOT_EQUAL;
            case LESS -> LESS;
            case LESS_EQUAL -> LESS_EQUAL;
            case GREATER -> GREATER;
            case GREATER_EQUAL -> GREATER_EQUAL;
            case AND -> AND;
            case OR -> OR;
            default -> throw new IllegalArgumentException("Not a binary operator: " + type);
        };
    }
}
