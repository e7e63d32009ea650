package org.asymptote.compiler.analysis.recurrence;

import org.asymptote.compiler.analysis.complexity.Bound;
import org.asymptote.compiler.analysis.complexity.GrowthClass;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class RecurrenceSolverTest {

    private RecurrenceSolver solver;

    @BeforeEach
    void setUp() {
        solver = new RecurrenceSolver();
    }

    private static RecurrenceDescriptor divide(int calls, double ratio, GrowthClass work) {
        return new RecurrenceDescriptor(Collections.nCopies(calls, new Shrink.Divide(ratio)), Bound.of(work));
    }

    private static RecurrenceDescriptor subtract(int calls, double step, GrowthClass work) {
        return new RecurrenceDescriptor(Collections.nCopies(calls, new Shrink.Subtract(step)), Bound.of(work));
    }

    @Test
    @DisplayName("T(n) = 2T(n/2) + n is n log n (merge sort)")
    void mergeSortIsMasterCase2() {
        RecurrenceSolution solution = solver.solve(divide(2, 2, GrowthClass.LINEAR));

        assertThat(solution.recurrenceCase()).isEqualTo(RecurrenceCase.MASTER_CASE_2);
        assertThat(solution.bound()).isEqualTo(Bound.of(GrowthClass.LINEARITHMIC));
    }

    @Test
    @DisplayName("T(n) = T(n/2) + 1 is log n (binary search)")
    void binarySearchIsMasterCase2() {
        RecurrenceSolution solution = solver.solve(divide(1, 2, GrowthClass.CONSTANT));

        assertThat(solution.recurrenceCase()).isEqualTo(RecurrenceCase.MASTER_CASE_2);
        assertThat(solution.bound()).isEqualTo(Bound.LOGARITHMIC);
    }

    @Test
    @DisplayName("T(n) = 7T(n/2) + n^2 is n^log2(7) (Strassen)")
    void strassenIsMasterCase1() {
        RecurrenceSolution solution = solver.solve(divide(7, 2, GrowthClass.QUADRATIC));

        assertThat(solution.recurrenceCase()).isEqualTo(RecurrenceCase.MASTER_CASE_1);
        assertThat(solution.bound().render("Θ")).isEqualTo("Θ(n^2.807)");
    }

    @Test
    @DisplayName("T(n) = 2T(n/2) + n^2 is n^2")
    void dominantWorkIsMasterCase3() {
        RecurrenceSolution solution = solver.solve(divide(2, 2, GrowthClass.QUADRATIC));

        assertThat(solution.recurrenceCase()).isEqualTo(RecurrenceCase.MASTER_CASE_3);
        assertThat(solution.bound()).isEqualTo(Bound.of(GrowthClass.QUADRATIC));
    }

    @Test
    @DisplayName("T(n) = 2T(n/2) + n log n is n log^2 n")
    void logFactorIsRaisedInCase2() {
        RecurrenceSolution solution = solver.solve(divide(2, 2, GrowthClass.LINEARITHMIC));

        assertThat(solution.bound()).isEqualTo(Bound.of(GrowthClass.polyLog(1, 2)));
    }

    @Test
    @DisplayName("T(n) = T(n-1) + 1 is n (factorial)")
    void singleSubtractiveTermSums() {
        RecurrenceSolution solution = solver.solve(subtract(1, 1, GrowthClass.CONSTANT));

        assertThat(solution.recurrenceCase()).isEqualTo(RecurrenceCase.SUBTRACTIVE_SUMMATION);
        assertThat(solution.bound()).isEqualTo(Bound.LINEAR);
    }

    @Test
    @DisplayName("T(n) = T(n-1) + n is n^2 (recursive selection sort)")
    void linearWorkSumsToQuadratic() {
        assertThat(solver.solve(subtract(1, 1, GrowthClass.LINEAR)).bound()).isEqualTo(Bound.of(GrowthClass.QUADRATIC));
    }

    @Test
    @DisplayName("T(n) = 2T(n-1) + 1 is 2^n (towers of Hanoi)")
    void multipleSubtractiveTermsAreExponential() {
        RecurrenceSolution solution = solver.solve(subtract(2, 1, GrowthClass.CONSTANT));

        assertThat(solution.recurrenceCase()).isEqualTo(RecurrenceCase.SUBTRACTIVE_EXPONENTIAL);
        assertThat(solution.bound().render("Θ")).isEqualTo("Θ(2^n)");
    }

    @Test
    @DisplayName("T(n) = T(n/2) + T(n/3) + n is indeterminate")
    void differentRatiosAreUnsupported() {
        RecurrenceDescriptor descriptor = new RecurrenceDescriptor(
                List.of(new Shrink.Divide(2), new Shrink.Divide(3)), Bound.LINEAR);

        RecurrenceSolution solution = solver.solve(descriptor);

        assertThat(solution.isSolved()).isFalse();
        assertThat(solution.recurrenceCase()).isEqualTo(RecurrenceCase.UNSUPPORTED);
        assertThat(solution.bound().isDeterminate()).isFalse();
    }

    @Test
    @DisplayName("T(n) = T(n-1) + T(n-2) + 1 is indeterminate")
    void differentStepsAreUnsupported() {
        RecurrenceDescriptor descriptor = new RecurrenceDescriptor(
                List.of(new Shrink.Subtract(1), new Shrink.Subtract(2)), Bound.CONSTANT);

        assertThat(solver.solve(descriptor).isSolved()).isFalse();
    }

    @Test
    void mixedFamiliesAndIndeterminateWorkAreUnsupported() {
        RecurrenceDescriptor mixed = new RecurrenceDescriptor(
                List.of(new Shrink.Divide(2), new Shrink.Subtract(1)), Bound.CONSTANT);
        RecurrenceDescriptor unknownWork = new RecurrenceDescriptor(
                List.of(new Shrink.Divide(2)), Bound.INDETERMINATE);

        assertThat(solver.solve(mixed).recurrenceCase()).isEqualTo(RecurrenceCase.UNSUPPORTED);
        assertThat(solver.solve(unknownWork).recurrenceCase()).isEqualTo(RecurrenceCase.UNSUPPORTED);
    }

    @Test
    void rendersTheRecurrence() {
        assertThat(divide(2, 2, GrowthClass.LINEAR).render()).isEqualTo("T(n) = 2·T(n/2) + n");
    }

    @Test
    void rejectsRecurrencesWithoutTerms() {
        assertThatThrownBy(() -> solver.solve(new RecurrenceDescriptor(List.of(), Bound.CONSTANT)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
