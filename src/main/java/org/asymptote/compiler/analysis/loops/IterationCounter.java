package org.asymptote.compiler.analysis.loops;

import org.asymptote.compiler.analysis.complexity.Bound;
import org.asymptote.compiler.analysis.complexity.Complexity;
import org.asymptote.compiler.analysis.magnitude.VariableMagnitudes;
import org.asymptote.compiler.diagnostics.DiagnosticCodes;
import org.asymptote.compiler.diagnostics.DiagnosticsEngine;
import org.asymptote.compiler.frontend.parser.ast.AssignNode;
import org.asymptote.compiler.frontend.parser.ast.AstNode;
import org.asymptote.compiler.frontend.parser.ast.ConditionBounds;
import org.asymptote.compiler.frontend.parser.ast.LoopKind;
import org.asymptote.compiler.frontend.parser.ast.LoopNode;
import org.asymptote.compiler.frontend.parser.ast.RangeBounds;
import org.asymptote.compiler.frontend.parser.ast.expr.BinaryExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.BinaryOperator;
import org.asymptote.compiler.frontend.parser.ast.expr.Expression;
import org.asymptote.compiler.frontend.parser.ast.expr.ExpressionPrinter;
import org.asymptote.compiler.frontend.parser.ast.expr.Expressions;
import org.asymptote.compiler.frontend.parser.ast.expr.Literal;
import org.asymptote.compiler.frontend.parser.ast.expr.UnaryExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.UnaryOperator;
import org.asymptote.compiler.frontend.parser.ast.expr.VariableRef;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives the symbolic iteration count of a loop from its bounds.
 * <p>
 * A FOR loop runs as often as the distance between its bounds (with a constant step).
 * A WHILE or REPEAT-UNTIL loop is split into the conjuncts of its continuation condition; a
 * conjunct is governed when its control variable is updated unconditionally in the body, by
 * a constant amount (linear count) or a constant factor (logarithmic count). The loop ends at
 * the first failing conjunct, so the upper count is the minimum over governed conjuncts. A
 * conjunct that depends on data may end the loop at any time, which drops the lower count to 1.
 */
public class IterationCounter {

    private final VariableMagnitudes scope;
    private final DiagnosticsEngine diagnostics;

    public IterationCounter(VariableMagnitudes scope, DiagnosticsEngine diagnostics) {
        this.scope = scope;
        this.diagnostics = diagnostics;
    }

    /**
     * @param loop The loop to count.
     * @return the iteration count; indeterminate (with a diagnostic) when the bounds are not recognized.
     */
    public IterationCount count(LoopNode loop) {
        if (loop.bounds() instanceof RangeBounds range) {
            return countRange(loop, range);
        }
        ConditionBounds condition = (ConditionBounds) loop.bounds();
        return countCondition(loop, condition.condition());
    }

    // --- FOR ---

    private IterationCount countRange(LoopNode loop, RangeBounds range) {
        double step = 1;
        if (range.step() != null) {
            Optional<Double> folded = Expressions.fold(range.step());
            if (folded.isEmpty()) {
                return malformed(loop, "step " + ExpressionPrinter.print(range.step()) + " is not a constant");
            }
            step = folded.get();
            if (step == 0) {
                return malformed(loop, "step is zero");
            }
            if (step < 0 && !range.descending()) {
                return malformed(loop, "negative step never reaches the end of an ascending range");
            }
            step = Math.abs(step);
        }

        Optional<Double> start = Expressions.fold(range.start());
        Optional<Double> end = Expressions.fold(range.end());
        if (start.isPresent() && end.isPresent()) {
            double span = range.descending() ? start.get() - end.get() : end.get() - start.get();
            double iterations = span < 0 ? 0 : Math.floor(span / step) + 1;
            if (!(iterations < Long.MAX_VALUE)) {
                // Constant, but too large to repeat the body's self-calls exactly.
                return IterationCount.of(Complexity.CONSTANT);
            }
            return IterationCount.exactly((long) iterations);
        }

        Bound startMagnitude = scope.estimator().estimate(range.start());
        Bound endMagnitude = scope.estimator().estimate(range.end());
        Bound from = range.descending() ? endMagnitude : startMagnitude;
        Bound to = range.descending() ? startMagnitude : endMagnitude;
        if (!from.isDeterminate() || !to.isDeterminate()) {
            return unresolved(loop, "cannot size the range " + ExpressionPrinter.print(range.start())
                    + (range.descending() ? " DOWNTO " : " TO ") + ExpressionPrinter.print(range.end()));
        }
        if (from.compareTo(to) > 0) {
            return malformed(loop, "range end " + ExpressionPrinter.print(range.descending() ? range.start() : range.end())
                    + " is asymptotically smaller than its start");
        }
        return IterationCount.of(Complexity.exact(to));
    }

    // --- WHILE / REPEAT-UNTIL ---

    private IterationCount countCondition(LoopNode loop, Expression condition) {
        Map<String, ControlUpdate> updates = new HashMap<>();
        for (AstNode statement : loop.body().statements()) {
            if (statement instanceof AssignNode assign) {
                ControlUpdate.of(assign).ifPresent(u -> updates.putIfAbsent(Expressions.key(u.variable()), u));
            }
        }
        // REPEAT-UNTIL continues while its exit condition is false.
        boolean negated = loop.kind() == LoopKind.REPEAT_UNTIL;
        Optional<Complexity> count = continuation(loop, condition, negated, updates);
        if (count.isEmpty()) {
            return unresolved(loop, "no control variable of " + ExpressionPrinter.print(condition)
                    + " is updated by a constant step or factor");
        }
        return IterationCount.of(count.get());
    }

    /**
     * @return the count while the (possibly negated) condition holds, or empty if it is not governed.
     */
    private Optional<Complexity> continuation(LoopNode loop, Expression condition, boolean negated,
                                              Map<String, ControlUpdate> updates) {
        if (condition instanceof UnaryExpr unary && unary.operator() == UnaryOperator.NOT) {
            return continuation(loop, unary.operand(), !negated, updates);
        }
        if (condition instanceof Literal literal && literal.value() instanceof Boolean flag) {
            return flag != negated ? Optional.empty() : Optional.of(Complexity.CONSTANT);
        }
        if (!(condition instanceof BinaryExpr binary)) {
            return Optional.empty();
        }
        BinaryOperator operator = binary.operator();
        if (operator == BinaryOperator.AND || operator == BinaryOperator.OR) {
            List<Optional<Complexity>> parts = new ArrayList<>();
            parts.add(continuation(loop, binary.left(), negated, updates));
            parts.add(continuation(loop, binary.right(), negated, updates));
            boolean conjunction = (operator == BinaryOperator.AND) != negated;
            return conjunction ? conjunction(parts) : disjunction(parts);
        }
        if (operator.isComparison()) {
            return comparison(loop, negated ? operator.negated() : operator, binary.left(), binary.right(), updates);
        }
        return Optional.empty();
    }

    private static Optional<Complexity> conjunction(List<Optional<Complexity>> parts) {
        Bound upper = null;
        Bound lower = null;
        boolean dataDependent = false;
        for (Optional<Complexity> part : parts) {
            if (part.isEmpty()) {
                dataDependent = true;
                continue;
            }
            upper = upper == null ? part.get().upper() : upper.min(part.get().upper());
            lower = lower == null ? part.get().lower() : lower.min(part.get().lower());
        }
        if (upper == null) {
            return Optional.empty();
        }
        return Optional.of(new Complexity(upper, dataDependent ? Bound.CONSTANT : lower));
    }

    private static Optional<Complexity> disjunction(List<Optional<Complexity>> parts) {
        Complexity result = null;
        for (Optional<Complexity> part : parts) {
            if (part.isEmpty()) {
                return Optional.empty();
            }
            result = result == null ? part.get()
                    : new Complexity(result.upper().max(part.get().upper()), result.lower().max(part.get().lower()));
        }
        return Optional.ofNullable(result);
    }

    private Optional<Complexity> comparison(LoopNode loop, BinaryOperator operator, Expression left, Expression right,
                                            Map<String, ControlUpdate> updates) {
        ControlUpdate update = null;
        Expression other = null;
        if (left instanceof VariableRef ref && updates.containsKey(Expressions.key(ref.name()))) {
            update = updates.get(Expressions.key(ref.name()));
            other = right;
        } else if (right instanceof VariableRef ref && updates.containsKey(Expressions.key(ref.name()))) {
            update = updates.get(Expressions.key(ref.name()));
            other = left;
            operator = operator.mirrored();
        }
        if (update == null) {
            return Optional.empty();
        }
        if (operator == BinaryOperator.EQUAL) {
            return Optional.of(Complexity.CONSTANT);
        }
        int required = switch (operator) {
            case LESS, LESS_EQUAL -> 1;
            case GREATER, GREATER_EQUAL -> -1;
            default -> 0;
        };
        if (required != 0 && required != update.direction()) {
            diagnostics.reportError(DiagnosticCodes.MALFORMED_LOOP_BOUND, "Loop variable " + update.variable()
                    + " moves away from its bound " + ExpressionPrinter.print(other), loop.line(), loop.column());
            return Optional.of(Complexity.INDETERMINATE);
        }
        Bound range = scope.estimator().estimate(other).max(scope.magnitudeOf(update.variable()));
        Bound count = update.geometric() ? range.logarithm() : range;
        return Optional.of(Complexity.exact(count));
    }

    private IterationCount malformed(LoopNode loop, String reason) {
        diagnostics.reportError(DiagnosticCodes.MALFORMED_LOOP_BOUND, "Malformed loop bound: " + reason,
                loop.line(), loop.column());
        return IterationCount.INDETERMINATE;
    }

    private IterationCount unresolved(LoopNode loop, String reason) {
        diagnostics.reportWarning(DiagnosticCodes.UNRESOLVED_LOOP_BOUND, "Unrecognized loop bound: " + reason,
                loop.line(), loop.column());
        return IterationCount.INDETERMINATE;
    }
}
