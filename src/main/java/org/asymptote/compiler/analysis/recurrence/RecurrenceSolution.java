package org.asymptote.compiler.analysis.recurrence;

import org.asymptote.compiler.analysis.complexity.Bound;

/**
 * The closed form of a recurrence.
 *
 * @param bound          The tight bound, or {@link Bound#INDETERMINATE} for an unsupported shape.
 * @param recurrenceCase The rule that produced it.
 * @param explanation    A one-line account of the derivation.
 */
public record RecurrenceSolution(Bound bound, RecurrenceCase recurrenceCase, String explanation) {

    public boolean isSolved() {
        return recurrenceCase != RecurrenceCase.UNSUPPORTED;
    }
}
