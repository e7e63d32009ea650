package org.asymptote.compiler.frontend.parser.ast.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Static queries over expression trees.
 */
public final class Expressions {

    private Expressions() {
    }

    /**
     * Collects the variable references of an expression in source order.
     *
     * @param expression        The expression to walk, may be null.
     * @param includeArrayBases Whether arrays count as references: the array of an {@code A[i]} access and
     *                          a plain variable passed to a function such as {@code length(A)}.
     */
    public static List<VariableRef> variables(Expression expression, boolean includeArrayBases) {
        List<VariableRef> found = new ArrayList<>();
        if (expression != null) {
            collect(expression, includeArrayBases, found);
        }
        return found;
    }

    private static void collect(Expression expression, boolean includeArrayBases, List<VariableRef> found) {
        if (expression instanceof VariableRef ref) {
            found.add(ref);
        } else if (expression instanceof IndexExpr index) {
            if (includeArrayBases || !(index.target() instanceof VariableRef)) {
                collect(index.target(), includeArrayBases, found);
            }
            collect(index.index(), includeArrayBases, found);
        } else if (expression instanceof BinaryExpr binary) {
            collect(binary.left(), includeArrayBases, found);
            collect(binary.right(), includeArrayBases, found);
        } else if (expression instanceof UnaryExpr unary) {
            collect(unary.operand(), includeArrayBases, found);
        } else if (expression instanceof ApplyExpr apply) {
            for (Expression argument : apply.arguments()) {
                if (includeArrayBases || !(argument instanceof VariableRef)) {
                    collect(argument, includeArrayBases, found);
                }
            }
        }
    }

    /**
     * @return true if the expression reads the named variable, ignoring case.
     */
    public static boolean references(Expression expression, String name) {
        return variables(expression, true).stream().anyMatch(ref -> ref.name().equalsIgnoreCase(name));
    }

    /**
     * @return true if the expression is a plain reference to the named variable, ignoring case.
     */
    public static boolean isVariable(Expression expression, String name) {
        return expression instanceof VariableRef ref && ref.name().equalsIgnoreCase(name);
    }

    /**
     * Evaluates an expression built only from numeric literals and arithmetic.
     *
     * @return the value, or empty if the expression is not a numeric constant.
     */
    public static Optional<Double> fold(Expression expression) {
        if (expression instanceof Literal literal) {
            if (!literal.isNumeric() || !Double.isFinite(literal.numericValue())) {
                return Optional.empty();
            }
            return Optional.of(literal.numericValue());
        }
        if (expression instanceof UnaryExpr unary && unary.operator() == UnaryOperator.NEGATE) {
            return fold(unary.operand()).map(v -> -v);
        }
        if (expression instanceof BinaryExpr binary) {
            Optional<Double> left = fold(binary.left());
            Optional<Double> right = fold(binary.right());
            if (left.isEmpty() || right.isEmpty()) {
                return Optional.empty();
            }
            double a = left.get();
            double b = right.get();
            Double value = switch (binary.operator()) {
                case ADD -> a + b;
                case SUBTRACT -> a - b;
                case MULTIPLY -> a * b;
                case DIVIDE -> b == 0 ? null : a / b;
                case INT_DIVIDE -> b == 0 ? null : Math.floor(a / b);
                case MODULO -> b == 0 ? null : a % b;
                case POWER -> Math.pow(a, b);
                default -> null;
            };
            return value == null || value.isNaN() || value.isInfinite() ? Optional.empty() : Optional.of(value);
        }
        return Optional.empty();
    }

    /**
     * @return the lower-cased name used for case-insensitive identifier lookups.
     */
    public static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
