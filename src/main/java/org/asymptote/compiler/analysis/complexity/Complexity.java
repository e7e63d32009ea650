package org.asymptote.compiler.analysis.complexity;

import java.util.Optional;

/**
 * The complexity of one node: an upper bound O, a lower bound Ω, and Θ when they coincide.
 * Θ is derived, never stored, so it can only be present when both bounds are determinate and equal.
 *
 * @param upper The worst-case bound O.
 * @param lower The best-case bound Ω.
 */
public record Complexity(Bound upper, Bound lower) {

    public static final Complexity CONSTANT = exact(Bound.CONSTANT);
    public static final Complexity INDETERMINATE = exact(Bound.INDETERMINATE);

    public Complexity {
        if (upper == null || lower == null) {
            throw new IllegalArgumentException("Bounds must not be null");
        }
    }

    public static Complexity exact(Bound bound) {
        return new Complexity(bound, bound);
    }

    public static Complexity exact(GrowthClass growth) {
        return exact(Bound.of(growth));
    }

    /**
     * @return Θ, present only if O and Ω are determinate and equal.
     */
    public Optional<Bound> theta() {
        return upper.isDeterminate() && upper.equals(lower) ? Optional.of(upper) : Optional.empty();
    }

    /**
     * Repetition: both bounds multiplied.
     */
    public Complexity times(Complexity other) {
        return new Complexity(upper.times(other.upper), lower.times(other.lower));
    }

    /**
     * Sequential composition: the dominant term of each bound.
     */
    public Complexity then(Complexity other) {
        return new Complexity(upper.max(other.upper), lower.max(other.lower));
    }

    /**
     * Alternative paths: the worst path for O, the cheapest for Ω.
     */
    public Complexity or(Complexity other) {
        return new Complexity(upper.max(other.upper), lower.min(other.lower));
    }

    public String upperLabel() {
        return upper.render("O");
    }

    public String lowerLabel() {
        return lower.render("Ω");
    }

    /**
     * @return the Θ label, or {@code absent} when the bounds differ or are indeterminate.
     */
    public String thetaLabel() {
        return theta().map(b -> b.render("Θ")).orElse("absent");
    }

    @Override
    public String toString() {
        return upperLabel() + ", " + lowerLabel() + ", Θ: " + thetaLabel();
    }
}
