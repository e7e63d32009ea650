package org.asymptote.compiler.frontend.parser.ast;

/**
 * The iteration bounds of a loop: a counted range for FOR, a condition for WHILE and REPEAT-UNTIL.
 */
public sealed interface LoopBounds permits RangeBounds, ConditionBounds {
}
