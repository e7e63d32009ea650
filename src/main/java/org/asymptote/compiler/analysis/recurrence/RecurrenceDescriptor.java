package org.asymptote.compiler.analysis.recurrence;

import org.asymptote.compiler.analysis.complexity.Bound;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A recurrence {@code T(n) = Σ T(shrink_i(n)) + f(n)} extracted from a recursive routine.
 *
 * @param terms The recursive terms along the worst path, one per self-call; {@code a} is their count.
 * @param work  The non-recursive work per call, f(n).
 */
public record RecurrenceDescriptor(List<Shrink> terms, Bound work) {

    public RecurrenceDescriptor {
        terms = List.copyOf(terms);
    }

    /**
     * @return the number of self-calls, {@code a}.
     */
    public int selfCalls() {
        return terms.size();
    }

    /**
     * @return a rendering such as {@code T(n) = 2·T(n/2) + n}, grouping identical terms.
     */
    public String render() {
        String recursive = terms.stream()
                .collect(Collectors.groupingBy(Shrink::render, LinkedHashMap::new, Collectors.counting()))
                .entrySet().stream()
                .map(e -> e.getValue() == 1 ? e.getKey() : e.getValue() + "·" + e.getKey())
                .collect(Collectors.joining(" + "));
        return "T(n) = " + recursive + " + " + work;
    }

    @Override
    public String toString() {
        return render();
    }
}
