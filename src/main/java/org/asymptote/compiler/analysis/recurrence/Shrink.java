package org.asymptote.compiler.analysis.recurrence;

import org.asymptote.compiler.analysis.complexity.GrowthClass;

/**
 * How one recursive call shrinks the input size.
 */
public sealed interface Shrink {

    /**
     * @return the term as it appears in a recurrence, e.g. {@code T(n/2)}.
     */
    String render();

    /**
     * {@code T(n / ratio)}.
     */
    record Divide(double ratio) implements Shrink {
        public Divide {
            if (!(ratio > 1)) {
                throw new IllegalArgumentException("Divide ratio must be greater than 1: " + ratio);
            }
        }

        @Override
        public String render() {
            return "T(n/" + GrowthClass.format(ratio) + ")";
        }
    }

    /**
     * {@code T(n - step)}.
     */
    record Subtract(double step) implements Shrink {
        public Subtract {
            if (!(step > 0)) {
                throw new IllegalArgumentException("Subtractive step must be positive: " + step);
            }
        }

        @Override
        public String render() {
            return "T(n-" + GrowthClass.format(step) + ")";
        }
    }
}
