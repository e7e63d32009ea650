package org.asymptote.compiler.analysis.recurrence;

import org.asymptote.compiler.frontend.parser.ast.CallNode;
import org.asymptote.compiler.frontend.parser.ast.RoutineNode;
import org.asymptote.compiler.frontend.parser.ast.expr.ApplyExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.BinaryExpr;
import org.asymptote.compiler.frontend.parser.ast.expr.Expression;
import org.asymptote.compiler.frontend.parser.ast.expr.Expressions;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads the shrink pattern of a self-call directly from its argument syntax.
 * <p>
 * Each argument is compared with the parameter at the same position: {@code p / c},
 * {@code p DIV c}, {@code floor(p / c)} and {@code ceil(p / c)} divide, {@code p - c}
 * subtracts. Positions whose parameter is a size variable win; otherwise the first
 * shrinking position is taken.
 */
public class ShrinkExtractor {

    private final Set<String> sizeVariables;

    /**
     * @param sizeVariables Lower-cased names that denote the input size.
     */
    public ShrinkExtractor(Set<String> sizeVariables) {
        this.sizeVariables = sizeVariables;
    }

    /**
     * @param routine The enclosing routine.
     * @param call    A self-call inside it.
     * @return the shrink term, or empty if no argument shrinks its parameter in a supported way.
     */
    public Optional<Shrink> extract(RoutineNode routine, CallNode call) {
        List<String> parameters = routine.parameters();
        List<Expression> arguments = call.arguments();
        Shrink first = null;
        for (int i = 0; i < Math.min(parameters.size(), arguments.size()); i++) {
            String parameter = parameters.get(i);
            Optional<Shrink> shrink = shrinkOf(parameter, arguments.get(i));
            if (shrink.isEmpty()) {
                continue;
            }
            if (sizeVariables.contains(Expressions.key(parameter))) {
                return shrink;
            }
            if (first == null) {
                first = shrink.get();
            }
        }
        return Optional.ofNullable(first);
    }

    private static Optional<Shrink> shrinkOf(String parameter, Expression argument) {
        Expression expr = argument;
        if (expr instanceof ApplyExpr apply && apply.arguments().size() == 1
                && (apply.isFunction("floor") || apply.isFunction("ceil"))) {
            expr = apply.arguments().get(0);
        }
        if (!(expr instanceof BinaryExpr binary) || !Expressions.isVariable(binary.left(), parameter)) {
            return Optional.empty();
        }
        Optional<Double> constant = Expressions.fold(binary.right());
        if (constant.isEmpty()) {
            return Optional.empty();
        }
        double c = constant.get();
        return switch (binary.operator()) {
            case DIVIDE, INT_DIVIDE -> c > 1 ? Optional.of(new Shrink.Divide(c)) : Optional.empty();
            case SUBTRACT -> c > 0 ? Optional.of(new Shrink.Subtract(c)) : Optional.empty();
            default -> Optional.empty();
        };
    }
}
