package org.asymptote.compiler.frontend.parser.ast;

/**
 * Exhaustive dispatch over the statement node kinds.
 *
 * @param <R> The result type of the traversal.
 */
public interface AstVisitor<R> {

    R visitSequence(SequenceNode node);

    R visitAssign(AssignNode node);

    R visitLoop(LoopNode node);

    R visitConditional(ConditionalNode node);

    R visitCall(CallNode node);

    R visitRoutine(RoutineNode node);

    R visitReturn(ReturnNode node);
}
