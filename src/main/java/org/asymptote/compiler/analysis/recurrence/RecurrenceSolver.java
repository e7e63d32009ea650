package org.asymptote.compiler.analysis.recurrence;

import org.asymptote.compiler.analysis.complexity.Bound;
import org.asymptote.compiler.analysis.complexity.GrowthClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Closed-form matcher for two recurrence families:
 * <ul>
 *     <li>divide-and-conquer {@code T(n) = a·T(n/b) + f(n)}, classified by the Master Theorem;</li>
 *     <li>subtractive {@code T(n) = a·T(n-c) + f(n)}, solved by summation.</li>
 * </ul>
 * Every other shape (mixed families, different ratios or steps, indeterminate work) is
 * answered with an indeterminate bound rather than an approximation. Stateless.
 */
public class RecurrenceSolver {

    private static final Logger LOG = LoggerFactory.getLogger(RecurrenceSolver.class);

    /**
     * Solves a recurrence.
     *
     * @param descriptor The recurrence; must have at least one recursive term.
     * @return the solution, never null.
     */
    public RecurrenceSolution solve(RecurrenceDescriptor descriptor) {
        List<Shrink> terms = descriptor.terms();
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("A recurrence needs at least one recursive term");
        }
        RecurrenceSolution solution;
        if (!descriptor.work().isDeterminate()) {
            solution = unsupported("non-recursive work f(n) is indeterminate");
        } else if (terms.stream().allMatch(t -> t instanceof Shrink.Divide)) {
            solution = divideAndConquer(terms, descriptor.work().growthClass());
        } else if (terms.stream().allMatch(t -> t instanceof Shrink.Subtract)) {
            solution = subtractive(terms, descriptor.work().growthClass());
        } else {
            solution = unsupported("mixes divide and subtract terms");
        }
        LOG.debug("{} solved as {} ({})", descriptor.render(), solution.bound(), solution.recurrenceCase());
        return solution;
    }

    private RecurrenceSolution divideAndConquer(List<Shrink> terms, GrowthClass work) {
        double ratio = ((Shrink.Divide) terms.get(0)).ratio();
        for (Shrink term : terms) {
            if (Math.abs(((Shrink.Divide) term).ratio() - ratio) > GrowthClass.EPSILON) {
                return unsupported("recursive terms shrink by different ratios");
            }
        }
        int a = terms.size();
        double critical = Math.log(a) / Math.log(ratio);
        String watershed = "n^(log_" + GrowthClass.format(ratio) + " " + a + ") = "
                + GrowthClass.polynomial(critical).label();

        if (work.isExponential()) {
            return new RecurrenceSolution(Bound.of(work), RecurrenceCase.MASTER_CASE_3,
                    "f(n) = " + work + " is polynomially larger than " + watershed);
        }
        double degree = work.degree();
        if (degree < critical - GrowthClass.EPSILON) {
            return new RecurrenceSolution(Bound.of(GrowthClass.polynomial(critical)), RecurrenceCase.MASTER_CASE_1,
                    "f(n) = " + work + " is polynomially smaller than " + watershed);
        }
        if (Math.abs(degree - critical) <= GrowthClass.EPSILON) {
            GrowthClass result = GrowthClass.polyLog(critical, work.logPower() + 1);
            return new RecurrenceSolution(Bound.of(result), RecurrenceCase.MASTER_CASE_2,
                    "f(n) = " + work + " matches " + watershed + " up to log^" + work.logPower() + " n");
        }
        return new RecurrenceSolution(Bound.of(work), RecurrenceCase.MASTER_CASE_3,
                "f(n) = " + work + " is polynomially larger than " + watershed);
    }

    private RecurrenceSolution subtractive(List<Shrink> terms, GrowthClass work) {
        double step = ((Shrink.Subtract) terms.get(0)).step();
        for (Shrink term : terms) {
            if (Math.abs(((Shrink.Subtract) term).step() - step) > GrowthClass.EPSILON) {
                return unsupported("recursive terms subtract different steps");
            }
        }
        int a = terms.size();
        if (a == 1) {
            if (work.isExponential()) {
                return new RecurrenceSolution(Bound.of(work), RecurrenceCase.SUBTRACTIVE_SUMMATION,
                        "summing an exponential f(n) = " + work + " is dominated by its last term");
            }
            GrowthClass result = GrowthClass.LINEAR.times(work);
            return new RecurrenceSolution(Bound.of(result), RecurrenceCase.SUBTRACTIVE_SUMMATION,
                    "n/" + GrowthClass.format(step) + " levels of f(n) = " + work);
        }
        double treeBase = Math.pow(a, 1 / step);
        GrowthClass tree = GrowthClass.exponential(treeBase);
        String levels = a + "^(n/" + GrowthClass.format(step) + ") calls";
        if (work.base() < tree.base()) {
            return new RecurrenceSolution(Bound.of(tree), RecurrenceCase.SUBTRACTIVE_EXPONENTIAL,
                    levels + " dominate f(n) = " + work);
        }
        if (work.base() > tree.base()) {
            return new RecurrenceSolution(Bound.of(work), RecurrenceCase.SUBTRACTIVE_EXPONENTIAL,
                    "f(n) = " + work + " dominates " + levels);
        }
        return new RecurrenceSolution(Bound.of(GrowthClass.LINEAR.times(work)), RecurrenceCase.SUBTRACTIVE_EXPONENTIAL,
                levels + " each contribute f(n) = " + work + " at every level");
    }

    private static RecurrenceSolution unsupported(String reason) {
        return new RecurrenceSolution(Bound.INDETERMINATE, RecurrenceCase.UNSUPPORTED, "unsupported recurrence: " + reason);
    }
}
