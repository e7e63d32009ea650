package org.asymptote.compiler.frontend.parser.ast;

import org.asymptote.compiler.frontend.parser.ast.expr.Expression;

/**
 * Bounds of a conditional loop. For WHILE the condition keeps the loop running,
 * for REPEAT-UNTIL it ends the loop.
 *
 * @param condition The loop condition.
 */
public record ConditionBounds(Expression condition) implements LoopBounds {
}
