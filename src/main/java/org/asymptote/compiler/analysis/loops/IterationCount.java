package org.asymptote.compiler.analysis.loops;

import org.asymptote.compiler.analysis.complexity.Complexity;

import java.util.OptionalLong;

/**
 * How often a loop body runs: an O/Ω pair, plus the exact count when the range is literal.
 *
 * @param count The symbolic iteration count.
 * @param exact The exact count for a literal range such as {@code FOR i ← 1 TO 3}.
 */
public record IterationCount(Complexity count, OptionalLong exact) {

    public static final IterationCount INDETERMINATE = of(Complexity.INDETERMINATE);

    public static IterationCount of(Complexity count) {
        return new IterationCount(count, OptionalLong.empty());
    }

    public static IterationCount exactly(long iterations) {
        return new IterationCount(Complexity.CONSTANT, OptionalLong.of(iterations));
    }
}
