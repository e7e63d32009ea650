package org.asymptote.compiler.analysis.magnitude;

import org.asymptote.compiler.analysis.complexity.Bound;
import org.asymptote.compiler.analysis.complexity.GrowthClass;
import org.asymptote.compiler.frontend.parser.ast.expr.ApplyExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.BinaryExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.Expression;
import org.asymptote.compiler.frontend.parser.ast.expr.ExpressionVisitor;
import org.asymptote.compiler.frontend.parser.ast.expr.Expressions;
import org.asymptote.compiler.frontend.parser.ast.expr.IndexExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.Literal;
import org.asymptote.compiler.frontend.parser.ast.expr.UnaryExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.UnaryOperator;
import org.asymptote.compiler.frontend.parser.ast.expr.VariableRef;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Estimates how large the value of an expression grows with the input size n.
 * <p>
 * Size variables and {@code length/len/size(..)} have magnitude n, literals are constant,
 * other variables take the magnitude recorded for them. Array elements are data and
 * therefore indeterminate.
 */
public class MagnitudeEstimator implements ExpressionVisitor<Bound> {

    private static final Set<String> SIZE_FUNCTIONS = Set.of("length", "len", "size");
    private static final Set<String> IDENTITY_FUNCTIONS = Set.of("floor", "ceil", "ceiling", "abs", "round", "int");
    private static final Set<String> LOG_FUNCTIONS = Set.of("log", "log2", "lg", "ln", "log10");

    private final Set<String> sizeVariables;
    private final Map<String, Bound> variables;

    /**
     * @param sizeVariables Lower-cased names that denote the input size.
     * @param variables     Magnitudes of other variables by lower-cased name; missing names are constant.
     */
    public MagnitudeEstimator(Set<String> sizeVariables, Map<String, Bound> variables) {
        this.sizeVariables = sizeVariables;
        this.variables = variables;
    }

    public Bound estimate(Expression expression) {
        return expression.accept(this);
    }

    @Override
    public Bound visitLiteral(Literal literal) {
        return Bound.CONSTANT;
    }

    @Override
    public Bound visitVariable(VariableRef variable) {
        String key = Expressions.key(variable.name());
        if (sizeVariables.contains(key)) {
            return Bound.LINEAR;
        }
        return variables.getOrDefault(key, Bound.CONSTANT);
    }

    @Override
    public Bound visitIndex(IndexExpr index) {
        return Bound.INDETERMINATE;
    }

    @Override
    public Bound visitBinary(BinaryExpr binary) {
        if (binary.operator().isComparison()) {
            return Bound.CONSTANT;
        }
        return switch (binary.operator()) {
            case AND, OR -> Bound.CONSTANT;
            case ADD -> estimate(binary.left()).max(estimate(binary.right()));
            case SUBTRACT -> difference(estimate(binary.left()), estimate(binary.right()));
            case MULTIPLY -> estimate(binary.left()).times(estimate(binary.right()));
            case DIVIDE, INT_DIVIDE -> quotient(estimate(binary.left()), estimate(binary.right()));
            case MODULO -> {
                Bound divisor = estimate(binary.right());
                yield divisor.isDeterminate() ? divisor : Bound.INDETERMINATE;
            }
            case POWER -> power(binary);
            default -> Bound.INDETERMINATE;
        };
    }

    private static Bound difference(Bound minuend, Bound subtrahend) {
        if (!minuend.isDeterminate() || !subtrahend.isDeterminate()) {
            return Bound.INDETERMINATE;
        }
        // n - n may cancel; the leading term is kept as an upper estimate.
        return minuend.compareTo(subtrahend) >= 0 ? minuend : Bound.INDETERMINATE;
    }

    private static Bound quotient(Bound dividend, Bound divisor) {
        if (!dividend.isDeterminate() || !divisor.isDeterminate()) {
            return Bound.INDETERMINATE;
        }
        if (divisor.isConstant()) {
            return dividend;
        }
        return Bound.of(dividend.growthClass().dividedBy(divisor.growthClass()));
    }

    private Bound power(BinaryExpr binary) {
        Optional<Double> exponent = Expressions.fold(binary.right());
        if (exponent.isPresent()) {
            Bound base = estimate(binary.left());
            return base.isDeterminate() ? Bound.of(base.growthClass().pow(exponent.get())) : Bound.INDETERMINATE;
        }
        Optional<Double> base = Expressions.fold(binary.left());
        Bound exponentMagnitude = estimate(binary.right());
        if (base.isPresent() && exponentMagnitude.isDeterminate()) {
            double b = Math.abs(base.get());
            if (b <= 1 || exponentMagnitude.isConstant()) {
                return Bound.CONSTANT;
            }
            if (exponentMagnitude.equals(Bound.LINEAR)) {
                return Bound.of(GrowthClass.exponential(b));
            }
        }
        return Bound.INDETERMINATE;
    }

    @Override
    public Bound visitUnary(UnaryExpr unary) {
        return unary.operator() == UnaryOperator.NOT ? Bound.CONSTANT : estimate(unary.operand());
    }

    @Override
    public Bound visitApply(ApplyExpr apply) {
        String function = Expressions.key(apply.function());
        List<Expression> arguments = apply.arguments();
        if (SIZE_FUNCTIONS.contains(function)) {
            return Bound.LINEAR;
        }
        if (arguments.isEmpty()) {
            return Bound.INDETERMINATE;
        }
        if (IDENTITY_FUNCTIONS.contains(function)) {
            return estimate(arguments.get(0));
        }
        if (LOG_FUNCTIONS.contains(function)) {
            return estimate(arguments.get(0)).logarithm();
        }
        if (function.equals("sqrt")) {
            Bound radicand = estimate(arguments.get(0));
            return radicand.isDeterminate() ? Bound.of(radicand.growthClass().pow(0.5)) : Bound.INDETERMINATE;
        }
        if (function.equals("min") || function.equals("max")) {
            Bound result = estimate(arguments.get(0));
            for (Expression argument : arguments.subList(1, arguments.size())) {
                Bound next = estimate(argument);
                result = function.equals("min") ? result.min(next) : result.max(next);
            }
            return result;
        }
        return Bound.INDETERMINATE;
    }
}
