package org.asymptote.compiler.analysis.recurrence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The self-calls along the worst path through a routine body.
 *
 * @param terms        One shrink term per self-call.
 * @param unresolvable True if some self-call could not be turned into a term, or the path is ambiguous.
 */
public record RecursionTally(List<Shrink> terms, boolean unresolvable) {

    public static final RecursionTally NONE = new RecursionTally(List.of(), false);
    public static final RecursionTally UNRESOLVABLE = new RecursionTally(List.of(), true);

    // Repetition of a literal loop beyond this many self-calls is not a supported shape.
    private static final int MAX_REPEATED_TERMS = 64;

    public RecursionTally {
        terms = List.copyOf(terms);
    }

    public static RecursionTally of(Shrink term) {
        return new RecursionTally(List.of(term), false);
    }

    public boolean isEmpty() {
        return terms.isEmpty() && !unresolvable;
    }

    /**
     * Sequential composition: both sets of self-calls happen.
     */
    public RecursionTally then(RecursionTally other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<Shrink> combined = new ArrayList<>(terms);
        combined.addAll(other.terms);
        return new RecursionTally(combined, unresolvable || other.unresolvable);
    }

    /**
     * Alternative branches: the branch with the most self-calls is the worst path.
     * Branches with the same number of different self-calls cannot be reconciled.
     */
    public RecursionTally or(RecursionTally other) {
        if (unresolvable || other.unresolvable) {
            return UNRESOLVABLE;
        }
        if (terms.size() != other.terms.size()) {
            return terms.size() > other.terms.size() ? this : other;
        }
        return sorted(terms).equals(sorted(other.terms)) ? this : UNRESOLVABLE;
    }

    /**
     * The self-calls of a loop body repeated a literal number of times.
     */
    public RecursionTally repeat(long times) {
        if (isEmpty() || unresolvable) {
            return this;
        }
        if (times < 0 || times > MAX_REPEATED_TERMS / terms.size()) {
            return UNRESOLVABLE;
        }
        List<Shrink> repeated = new ArrayList<>();
        for (long i = 0; i < times; i++) {
            repeated.addAll(terms);
        }
        return new RecursionTally(repeated, false);
    }

    private static List<String> sorted(List<Shrink> terms) {
        List<String> rendered = new ArrayList<>();
        for (Shrink term : terms) {
            rendered.add(term.render());
        }
        Collections.sort(rendered);
        return rendered;
    }
}
