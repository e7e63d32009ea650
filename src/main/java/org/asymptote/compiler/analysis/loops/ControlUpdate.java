package org.asymptote.compiler.analysis.loops;

import org.asymptote.compiler.frontend.parser.ast.AssignNode;
import org.asymptote.compiler.frontend.parser.ast.expr.ApplyExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.BinaryExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.Expression;
import org.asymptote.compiler.frontend.parser.ast.expr.Expressions;

import java.util.Optional;

/**
 * A recognized update of a loop control variable.
 *
 * @param variable  The updated variable.
 * @param geometric True for {@code v * c} or {@code v / c} style updates, false for {@code v ± c}.
 * @param direction +1 if the value grows, -1 if it shrinks.
 */
record ControlUpdate(String variable, boolean geometric, int direction) {

    /**
     * Recognizes {@code v ← v ± c}, {@code v ← v * c}, {@code v ← c * v}, {@code v ← v / c},
     * {@code v ← v DIV c} and {@code v ← floor|ceil(v / c)} with a numeric constant c.
     */
    static Optional<ControlUpdate> of(AssignNode assign) {
        String v = assign.targetVariable();
        if (v == null) {
            return Optional.empty();
        }
        Expression value = assign.value();
        if (value instanceof ApplyExpr apply && apply.arguments().size() == 1
                && (apply.isFunction("floor") || apply.isFunction("ceil"))) {
            value = apply.arguments().get(0);
        }
        if (!(value instanceof BinaryExpr binary)) {
            return Optional.empty();
        }
        boolean leftIsV = Expressions.isVariable(binary.left(), v);
        boolean rightIsV = Expressions.isVariable(binary.right(), v);
        Optional<Double> right = Expressions.fold(binary.right());
        Optional<Double> left = Expressions.fold(binary.left());
        switch (binary.operator()) {
            case ADD -> {
                Optional<Double> c = leftIsV ? right : rightIsV ? left : Optional.empty();
                return c.filter(x -> x != 0).map(x -> new ControlUpdate(v, false, x > 0 ? 1 : -1));
            }
            case SUBTRACT -> {
                return leftIsV ? right.filter(x -> x != 0).map(x -> new ControlUpdate(v, false, x > 0 ? -1 : 1))
                        : Optional.empty();
            }
            case MULTIPLY -> {
                Optional<Double> c = leftIsV ? right : rightIsV ? left : Optional.empty();
                return c.filter(x -> x > 1).map(x -> new ControlUpdate(v, true, 1));
            }
            case DIVIDE, INT_DIVIDE -> {
                return leftIsV ? right.filter(x -> x > 1).map(x -> new ControlUpdate(v, true, -1)) : Optional.empty();
            }
            default -> {
                return Optional.empty();
            }
        }
    }
}
