package org.asymptote.compiler.analysis;

import org.asymptote.compiler.analysis.complexity.Complexity;
import org.asymptote.compiler.analysis.recurrence.RecurrenceDescriptor;
import org.asymptote.compiler.analysis.recurrence.RecurrenceSolution;

import java.util.Optional;

/**
 * The memoized analysis of one routine.
 *
 * @param name       The routine name as declared.
 * @param complexity The cost of one call.
 * @param recurrence The recurrence of a recursive routine, or null.
 * @param solution   The solver's answer for that recurrence, or null.
 */
public record RoutineAnalysis(String name, Complexity complexity, RecurrenceDescriptor recurrence,
                              RecurrenceSolution solution) {

    public boolean isRecursive() {
        return recurrence != null;
    }

    public Optional<RecurrenceDescriptor> recurrenceDescriptor() {
        return Optional.ofNullable(recurrence);
    }

    public Optional<RecurrenceSolution> recurrenceSolution() {
        return Optional.ofNullable(solution);
    }
}
