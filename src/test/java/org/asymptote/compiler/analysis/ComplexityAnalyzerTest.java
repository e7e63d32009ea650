package org.asymptote.compiler.analysis;

import org.asymptote.compiler.analysis.complexity.Complexity;
import org.asymptote.compiler.analysis.recurrence.RecurrenceCase;
import org.asymptote.compiler.diagnostics.Diagnostic;
import org.asymptote.compiler.diagnostics.DiagnosticCodes;
import org.asymptote.compiler.frontend.lexer.Lexer;
import org.asymptote.compiler.frontend.parser.Parser;
import org.asymptote.compiler.frontend.parser.ast.AstNode;
import org.asymptote.compiler.frontend.parser.ast.LoopNode;
import org.asymptote.compiler.frontend.parser.ast.SequenceNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ComplexityAnalyzerTest {

    private ComplexityAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new ComplexityAnalyzer();
    }

    private static SequenceNode parse(String source) {
        return new Parser(new Lexer(source).scanTokens()).parse();
    }

    private AnalysisResult analyze(String source) {
        return analyzer.analyze(parse(source));
    }

    @Test
    @DisplayName("A single assignment is Θ(1)")
    void assignmentIsConstant() {
        AnalysisResult result = analyze("x ← 1");

        assertThat(result.complexity().thetaLabel()).isEqualTo("Θ(1)");
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    @DisplayName("A loop from 1 to n is Θ(n)")
    void singleLoopIsLinear() {
        AnalysisResult result = analyze("""
                s ← 0
                FOR i ← 1 TO n DO
                    s ← s + i
                END FOR
                """);

        assertThat(result.complexity().thetaLabel()).isEqualTo("Θ(n)");
    }

    @Test
    @DisplayName("Nested loops up to n are Θ(n^2)")
    void nestedLoopsAreQuadratic() {
        AnalysisResult result = analyze("""
                s ← 0
                FOR i ← 1 TO n DO
                    FOR j ← 1 TO i DO
                        s ← s + j
                    END FOR
                END FOR
                """);

        assertThat(result.complexity().thetaLabel()).isEqualTo("Θ(n^2)");
    }

    @Test
    @DisplayName("A conditional loop is O(n), Ω(1) without Θ")
    void conditionalHasNoTightBound() {
        AnalysisResult result = analyze("""
                s ← 0
                IF n > 10 THEN
                    FOR i ← 1 TO n DO
                        s ← s + i
                    END FOR
                END IF
                """);

        Complexity complexity = result.complexity();
        assertThat(complexity.upperLabel()).isEqualTo("O(n)");
        assertThat(complexity.lowerLabel()).isEqualTo("Ω(1)");
        assertThat(complexity.theta()).isEmpty();
        assertThat(complexity.thetaLabel()).isEqualTo("absent");
    }

    @Test
    @DisplayName("Merge sort is Θ(n log n)")
    void mergeSortIsLinearithmic() {
        AnalysisResult result = analyze("""
                FUNCTION MergeSort(A, n)
                    IF n ≤ 1 THEN
                        RETURN
                    END IF
                    CALL MergeSort(A, n / 2)
                    CALL MergeSort(A, n / 2)
                    FOR i ← 1 TO n DO
                        B[i] ← A[i]
                    END FOR
                END FUNCTION
                """);

        assertThat(result.complexity().thetaLabel()).isEqualTo("Θ(n log n)");
        RoutineAnalysis routine = result.routine("mergesort").orElseThrow();
        assertThat(routine.isRecursive()).isTrue();
        assertThat(routine.recurrenceDescriptor()).hasValueSatisfying(
                r -> assertThat(r.render()).isEqualTo("T(n) = 2·T(n/2) + n"));
        assertThat(routine.recurrenceSolution()).hasValueSatisfying(
                s -> assertThat(s.recurrenceCase()).isEqualTo(RecurrenceCase.MASTER_CASE_2));
    }

    @Test
    @DisplayName("Binary search is Θ(log n)")
    void binarySearchIsLogarithmic() {
        AnalysisResult result = analyze("""
                FUNCTION BinarySearch(A, x, n)
                    IF n ≤ 1 THEN
                        RETURN 0
                    END IF
                    mid ← n DIV 2
                    IF A[mid] < x THEN
                        CALL BinarySearch(A, x, n DIV 2)
                    ELSE
                        CALL BinarySearch(A, x, n DIV 2)
                    END IF
                END FUNCTION
                """);

        assertThat(result.complexity().thetaLabel()).isEqualTo("Θ(log n)");
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    @DisplayName("Towers of Hanoi is Θ(2^n)")
    void hanoiIsExponential() {
        AnalysisResult result = analyze("""
                PROCEDURE Hanoi(n, source, target, aux)
                    IF n = 0 THEN
                        RETURN
                    END IF
                    CALL Hanoi(n - 1, source, aux, target)
                    moves ← moves + 1
                    CALL Hanoi(n - 1, aux, target, source)
                END PROCEDURE
                """);

        assertThat(result.complexity().thetaLabel()).isEqualTo("Θ(2^n)");
    }

    @Test
    @DisplayName("Self-calls repeated by a huge literal loop are an unresolved recurrence")
    void hugeLiteralLoopAroundSelfCallsIsIndeterminate() {
        for (String end : new String[] {"5000000000000000000", "100000000000000000000"}) {
            AnalysisResult result = analyze("""
                    FUNCTION F(n)
                        IF n ≤ 1 THEN
                            RETURN 1
                        END IF
                        FOR i ← 1 TO %s DO
                            CALL F(n / 2)
                            CALL F(n / 2)
                        END FOR
                    END FUNCTION
                    """.formatted(end));

            assertThat(result.complexity().upperLabel()).isEqualTo("indeterminate");
            assertThat(result.diagnostics())
                    .extracting(Diagnostic::code)
                    .containsExactly(DiagnosticCodes.UNRESOLVED_RECURRENCE);
        }
    }

    @Test
    @DisplayName("A literal loop beyond the long range is still constant")
    void literalLoopBeyondLongRangeIsConstant() {
        AnalysisResult result = analyze("""
                s ← 0
                FOR i ← 1 TO 100000000000000000000 DO
                    s ← s + i
                END FOR
                """);

        assertThat(result.complexity().thetaLabel()).isEqualTo("Θ(1)");
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    @DisplayName("A literal that overflows to infinity leaves the bound unresolved")
    void overflowingLiteralDoesNotAbortTheAnalysis() {
        AnalysisResult result = analyze("""
                x ← n ^ 1%s
                FOR i ← 1 TO x DO
                    s ← i
                END FOR
                """.formatted("0".repeat(400)));

        assertThat(result.complexity().upperLabel()).isEqualTo("indeterminate");
        assertThat(result.diagnostics())
                .extracting(Diagnostic::code)
                .containsExactly(DiagnosticCodes.UNRESOLVED_LOOP_BOUND);
    }

    @Test
    @DisplayName("T(n/2) + T(n/3) is indeterminate with a diagnostic")
    void differentRatiosAreIndeterminate() {
        AnalysisResult result = analyze("""
                FUNCTION F(n)
                    IF n ≤ 1 THEN
                        RETURN 1
                    END IF
                    CALL F(n / 2)
                    CALL F(n / 3)
                END FUNCTION
                """);

        assertThat(result.complexity().upper().isDeterminate()).isFalse();
        assertThat(result.complexity().upperLabel()).isEqualTo("indeterminate");
        assertThat(result.diagnostics())
                .extracting(Diagnostic::code)
                .containsExactly(DiagnosticCodes.UNRESOLVED_RECURRENCE);
    }

    @Test
    void callerPaysTheCalleeCost() {
        AnalysisResult result = analyze("""
                PROCEDURE Scan(A, n)
                    FOR i ← 1 TO n DO
                        A[i] ← 0
                    END FOR
                END PROCEDURE
                FOR k ← 1 TO n DO
                    CALL Scan(A, n)
                END FOR
                """);

        assertThat(result.complexity().thetaLabel()).isEqualTo("Θ(n^2)");
        assertThat(result.routine("Scan").orElseThrow().complexity().thetaLabel()).isEqualTo("Θ(n)");
    }

    @Test
    void undefinedNamesAreDiagnosedButDoNotAbort() {
        AnalysisResult result = analyze("""
                x ← y + 1
                z ← y * 2
                CALL Missing(x)
                FOR i ← 1 TO n DO
                    x ← x + i
                END FOR
                """);

        assertThat(result.complexity().thetaLabel()).isEqualTo("Θ(n)");
        assertThat(result.diagnostics())
                .extracting(Diagnostic::code)
                .containsExactly(DiagnosticCodes.UNDEFINED_VARIABLE, DiagnosticCodes.UNDEFINED_ROUTINE);
        assertThat(result.diagnostics()).allMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
        assertThat(result.diagnostics().get(0).line()).isEqualTo(1);
    }

    @Test
    void mutualRecursionIsIndeterminate() {
        AnalysisResult result = analyze("""
                PROCEDURE Ping(n)
                    CALL Pong(n - 1)
                END PROCEDURE
                PROCEDURE Pong(n)
                    CALL Ping(n - 1)
                END PROCEDURE
                """);

        assertThat(result.complexity().upper().isDeterminate()).isFalse();
        assertThat(result.diagnostics())
                .extracting(Diagnostic::code)
                .contains(DiagnosticCodes.MUTUAL_RECURSION);
    }

    @Test
    void unresolvedLoopOnlyAffectsItsAncestors() {
        SequenceNode root = parse("""
                FOR i ← 1 TO n DO
                    x ← i
                END FOR
                WHILE done = FALSE DO
                    done ← probe(x)
                END WHILE
                """);

        AnalysisResult result = analyzer.analyze(root);

        AstNode first = root.statements().get(0);
        assertThat(result.complexityOf(first).thetaLabel()).isEqualTo("Θ(n)");
        assertThat(result.complexityOf(root).upper().isDeterminate()).isFalse();
        LoopNode second = (LoopNode) root.statements().get(1);
        assertThat(result.complexityOf(second.body()).thetaLabel()).isEqualTo("Θ(1)");
    }

    @Test
    void analyzingTwiceGivesIdenticalResults() {
        SequenceNode root = parse("""
                FOR i ← 1 TO n DO
                    j ← n
                    WHILE j > 1 DO
                        j ← j / 2
                    END WHILE
                END FOR
                """);

        AnalysisResult first = analyzer.analyze(root);
        AnalysisResult second = analyzer.analyze(root);

        assertThat(first.complexity()).isEqualTo(second.complexity());
        assertThat(first.complexity().thetaLabel()).isEqualTo("Θ(n log n)");
        assertThat(first.diagnostics()).isEqualTo(second.diagnostics());
        for (AstNode statement : root.statements()) {
            assertThat(first.complexityOf(statement)).isEqualTo(second.complexityOf(statement));
        }
    }

    @Test
    void unknownNodeIsRejected() {
        AnalysisResult result = analyze("x ← 1");
        AstNode foreign = parse("y ← 2").statements().get(0);

        assertThatThrownBy(() -> result.complexityOf(foreign)).isInstanceOf(IllegalArgumentException.class);
    }
}
