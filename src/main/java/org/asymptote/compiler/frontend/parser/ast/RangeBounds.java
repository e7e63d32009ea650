package org.asymptote.compiler.frontend.parser.ast;

import org.asymptote.compiler.frontend.parser.ast.expr.Expression;

/**
 * Bounds of a counted loop {@code FOR variable ← start TO|DOWNTO end [STEP step]}.
 *
 * @param variable   The loop variable.
 * @param start      The initial value.
 * @param end        The final value.
 * @param step       The step expression, or null for the implicit step of one.
 * @param descending True for {@code DOWNTO}.
 */
public record RangeBounds(String variable, Expression start, Expression end, Expression step, boolean descending)
        implements LoopBounds {
}
