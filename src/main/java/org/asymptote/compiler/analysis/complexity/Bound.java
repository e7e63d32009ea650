package org.asymptote.compiler.analysis.complexity;

import java.util.Objects;
import java.util.Optional;

/**
 * One asymptotic bound: either a closed-form {@link GrowthClass} or the first-class value
 * "indeterminate", meaning the rules could not resolve it. Every operation propagates
 * indeterminacy.
 */
public final class Bound implements Comparable<Bound> {

    public static final Bound INDETERMINATE = new Bound(null);
    public static final Bound CONSTANT = new Bound(GrowthClass.CONSTANT);
    public static final Bound LOGARITHMIC = new Bound(GrowthClass.LOGARITHMIC);
    public static final Bound LINEAR = new Bound(GrowthClass.LINEAR);

    private final GrowthClass growth;

    private Bound(GrowthClass growth) {
        this.growth = growth;
    }

    public static Bound of(GrowthClass growth) {
        return growth == null ? INDETERMINATE : new Bound(growth);
    }

    public boolean isDeterminate() {
        return growth != null;
    }

    public Optional<GrowthClass> growth() {
        return Optional.ofNullable(growth);
    }

    /**
     * @return the growth class.
     * @throws IllegalStateException if the bound is indeterminate.
     */
    public GrowthClass growthClass() {
        if (growth == null) {
            throw new IllegalStateException("Bound is indeterminate");
        }
        return growth;
    }

    public boolean isConstant() {
        return growth != null && growth.isConstant();
    }

    public Bound times(Bound other) {
        if (!isDeterminate() || !other.isDeterminate()) {
            return INDETERMINATE;
        }
        return of(growth.times(other.growth));
    }

    public Bound max(Bound other) {
        if (!isDeterminate() || !other.isDeterminate()) {
            return INDETERMINATE;
        }
        return growth.compareTo(other.growth) >= 0 ? this : other;
    }

    public Bound min(Bound other) {
        if (!isDeterminate() || !other.isDeterminate()) {
            return INDETERMINATE;
        }
        return growth.compareTo(other.growth) <= 0 ? this : other;
    }

    public Bound logarithm() {
        return isDeterminate() ? of(growth.logarithm()) : INDETERMINATE;
    }

    /**
     * Orders determinate bounds by growth; indeterminate sorts above everything.
     */
    @Override
    public int compareTo(Bound other) {
        if (!isDeterminate() || !other.isDeterminate()) {
            return Boolean.compare(!isDeterminate(), !other.isDeterminate());
        }
        return growth.compareTo(other.growth);
    }

    /**
     * @return the label wrapped in the given symbol, e.g. {@code O(n)}, or {@code indeterminate}.
     */
    public String render(String symbol) {
        return isDeterminate() ? symbol + "(" + growth.label() + ")" : "indeterminate";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bound other)) return false;
        return Objects.equals(growth, other.growth);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(growth);
    }

    @Override
    public String toString() {
        return isDeterminate() ? growth.label() : "indeterminate";
    }
}
